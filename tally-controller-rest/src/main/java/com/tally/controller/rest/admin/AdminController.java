package com.tally.controller.rest.admin;

import com.tally.service.core.rollup.RollupAggregator;
import com.tally.service.core.rollup.RollupResult;
import com.tally.service.core.scheduler.CronJob;
import com.tally.service.core.scheduler.CronScheduler;
import com.tally.service.storage.impl.SchemaAdminService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints; only registered with {@code tally.admin.enabled=true}. */
@Slf4j
@RestController
@RequestMapping("/admin")
@ConditionalOnProperty(prefix = "tally.admin", name = "enabled", havingValue = "true")
public class AdminController {

    private final RollupAggregator rollupAggregator;
    private final CronScheduler cronScheduler;
    private final SchemaAdminService schemaAdminService;

    public AdminController(
            RollupAggregator rollupAggregator, CronScheduler cronScheduler, SchemaAdminService schemaAdminService) {
        this.rollupAggregator = rollupAggregator;
        this.cronScheduler = cronScheduler;
        this.schemaAdminService = schemaAdminService;
    }

    @PostMapping("/rollups/{period}")
    public RollupResult rollup(@PathVariable String period) {
        log.info("Manual rollup requested: {}", period);
        return rollupAggregator.aggregate(period);
    }

    @GetMapping("/schedules")
    public List<Map<String, Object>> schedules() {
        return cronScheduler.jobs().stream().map(AdminController::describe).toList();
    }

    @DeleteMapping("/schema/{schema}")
    public Map<String, Object> dropSchema(@PathVariable String schema) {
        List<String> dropped = schemaAdminService.dropAllTables(schema);
        return Map.of("schema", schema, "dropped", dropped);
    }

    private static Map<String, Object> describe(CronJob job) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", job.name());
        view.put("spec", job.spec().expression());
        view.put("zone", job.spec().zone().toString());
        view.put("state", job.state().name());
        view.put("nextFireTime", job.nextFireTime());
        view.put("lastFire", job.lastFire());
        view.put("fireCount", job.fireCount());
        return view;
    }
}
