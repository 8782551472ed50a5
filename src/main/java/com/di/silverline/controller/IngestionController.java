package com.di.silverline.controller;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.coordinator.IngestionCoordinator;
import com.di.silverline.coordinator.RunSummary;
import com.di.silverline.strategy.StrategyDescriptor;
import com.di.silverline.strategy.StrategyRegistry;
import com.di.silverline.warehouse.TargetRelation;
import com.di.silverline.warehouse.TargetRelationManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST entry points for scheduler and operator use.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/ingestion/runs?date=yyyy-MM-dd&amp;table=a&amp;table=b</td>
 *     <td>Run ingestion for a date (default: today) and optional table subset; synchronous</td></tr>
 * <tr><td>GET</td><td>/api/ingestion/strategies</td><td>Configured table strategies</td></tr>
 * <tr><td>GET</td><td>/api/ingestion/tables/{table}</td><td>Silver table metadata</td></tr>
 * </table>
 *
 * <p>A run answers 200 even when tables failed; the summary says which.
 */
@Slf4j
@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionCoordinator coordinator;
    private final StrategyRegistry registry;
    private final TargetRelationManager targets;
    private final SilverlineProperties properties;

    @PostMapping("/runs")
    public ResponseEntity<RunSummary> run(
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "table", required = false) List<String> tables) {
        LocalDate logicalDate = date != null ? date : LocalDate.now(properties.zone());
        log.info("[CONTROLLER] POST /api/ingestion/runs date={} tables={}", logicalDate, tables);
        return ResponseEntity.ok(coordinator.execute(logicalDate, tables == null ? List.of() : tables));
    }

    @GetMapping("/strategies")
    public List<StrategyDescriptor> strategies() {
        return registry.descriptors();
    }

    @GetMapping("/tables/{table}")
    public ResponseEntity<Map<String, Object>> table(@PathVariable("table") String table) {
        Optional<TargetRelation> relation = targets.describe(table);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("table", properties.silverTable(table).qualified());
        body.put("exists", relation.isPresent());
        body.put("strategy", registry.resolve(table).map(d -> d.kind().getConfigKey()).orElse(null));
        relation.ifPresent(r -> {
            body.put("numRows", r.numRows());
            body.put("partitionField", r.partition().field());
            body.put("clusterColumns", r.clusterColumns());
            body.put("columns", r.columnNames());
        });
        return relation.isPresent() ? ResponseEntity.ok(body) : ResponseEntity.status(404).body(body);
    }
}
