package com.tally.controller.rest;

import com.tally.api.dto.AvatarRequest;
import com.tally.api.dto.HistoryEntryView;
import com.tally.api.dto.NameRequest;
import com.tally.api.dto.PresenceRequest;
import com.tally.service.core.retention.HistoryLogType;
import com.tally.service.core.retention.HistoryService;
import com.tally.service.core.retention.InsertOutcome;
import com.tally.service.core.retention.PresenceStatus;
import jakarta.validation.Valid;
import java.util.Base64;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/history/{subjectId}")
public class HistoryController {

    private final HistoryService historyService;

    public HistoryController(HistoryService historyService) {
        this.historyService = historyService;
    }

    @PostMapping("/presence")
    public InsertOutcome presence(@PathVariable long subjectId, @RequestBody PresenceRequest request) {
        return historyService.recordPresence(subjectId, PresenceStatus.fromValue(request.status()), request.at());
    }

    @PostMapping("/avatar")
    public InsertOutcome avatar(@PathVariable long subjectId, @Valid @RequestBody AvatarRequest request) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(request.data());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Avatar data must be base64 encoded", ex);
        }
        return historyService.recordAvatar(subjectId, request.mimeFormat(), bytes, request.at());
    }

    @PostMapping("/name")
    public InsertOutcome name(@PathVariable long subjectId, @Valid @RequestBody NameRequest request) {
        return historyService.recordName(subjectId, request.name(), request.at());
    }

    @GetMapping("/{logType}")
    public List<HistoryEntryView> history(@PathVariable long subjectId, @PathVariable String logType) {
        return historyService.history(subjectId, HistoryLogType.fromValue(logType)).stream()
                .map(HistoryEntryView::from)
                .toList();
    }
}
