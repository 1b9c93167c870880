package com.openforge.storeagent.routing;

import com.openforge.storeagent.embedding.ToolExampleStore;
import com.openforge.storeagent.routing.dto.ResolveRequest;
import com.openforge.storeagent.routing.dto.RouteResponse;
import com.openforge.storeagent.routing.dto.StoreStatsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Administrative endpoints over the tool example store.
 *
 *   GET  /api/tool-examples/stats          counts per domain, learned vs curated
 *   POST /api/tool-examples/seed?clear=    (re)load the catalog seed file
 *   POST /api/tool-examples/resolve        dry-run routing of one utterance
 */
@Slf4j
@RestController
@RequestMapping("/api/tool-examples")
@RequiredArgsConstructor
public class ToolExampleController {

    private final ToolExampleStore  store;
    private final ToolCatalogSeeder seeder;
    private final ToolRouter        router;

    @GetMapping("/stats")
    public ResponseEntity<StoreStatsResponse> stats() {
        long total   = store.count();
        long learned = store.countLearned();
        return ResponseEntity.ok(new StoreStatsResponse(total, learned, total - learned, store.countPerDomain()));
    }

    @PostMapping("/seed")
    public ResponseEntity<ToolCatalogSeeder.SeedResult> seed(
            @RequestParam(name = "clear", defaultValue = "false") boolean clear) {
        ToolCatalogSeeder.SeedResult result = seeder.seed(clear);
        log.info("[Seeder] Manual seed (clear={}): {}", clear, result);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/resolve")
    public ResponseEntity<RouteResponse> resolve(@Valid @RequestBody ResolveRequest request) {
        return ResponseEntity.ok(RouteResponse.from(router.resolve(request.utterance(), request.domain())));
    }
}
