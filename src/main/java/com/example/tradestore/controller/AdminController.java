package com.example.tradestore.controller;

import com.example.tradestore.controller.dto.ContextRequest;
import com.example.tradestore.model.OperationLogEntry;
import com.example.tradestore.store.TradeDocumentStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Trade Store Admin", description = "Purge and operation log")
public class AdminController {

    private final TradeDocumentStore tradeDocumentStore;

    @PostMapping("/purge")
    @Operation(summary = "Purge all trades", description = "Removes every trade and clears the operation log")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Store purged"),
            @ApiResponse(responseCode = "422", description = "Context validation failed")
    })
    public Mono<Map<String, Object>> purge(@RequestBody ContextRequest request) {
        log.warn("Received purge request");

        return Mono.fromCallable(() -> tradeDocumentStore.purge(request.context()))
                .map(removed -> Map.<String, Object>of(
                        "success", true,
                        "tradesDeleted", removed
                ));
    }

    @GetMapping("/operations")
    @Operation(summary = "Operation log", description = "Successful mutations, oldest first, optionally for one trade")
    @ApiResponse(responseCode = "200", description = "Operation log retrieved")
    public Flux<OperationLogEntry> operations(
            @Parameter(description = "Only entries for this trade (optional)")
            @RequestParam(value = "tradeId", required = false) String tradeId) {
        return Flux.defer(() -> Flux.fromIterable(tradeId == null
                ? tradeDocumentStore.operationLog()
                : tradeDocumentStore.operationLog(tradeId)));
    }
}
