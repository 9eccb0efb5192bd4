package com.example.tradestore.controller;

import com.example.tradestore.controller.dto.ListTradesRequest;
import com.example.tradestore.controller.dto.ListTradesResponse;
import com.example.tradestore.controller.dto.PatchTradeRequest;
import com.example.tradestore.controller.dto.SaveTradeRequest;
import com.example.tradestore.controller.dto.SaveTradeResponse;
import com.example.tradestore.controller.dto.TradeIdRequest;
import com.example.tradestore.controller.dto.TradeIdsRequest;
import com.example.tradestore.filter.FilterParser;
import com.example.tradestore.filter.TradeFilter;
import com.example.tradestore.model.TradeRecord;
import com.example.tradestore.model.TradeType;
import com.example.tradestore.model.ValidationResult;
import com.example.tradestore.service.TradeTemplateFactory;
import com.example.tradestore.store.DeleteResult;
import com.example.tradestore.store.LoadResult;
import com.example.tradestore.store.TradeDocumentStore;
import com.example.tradestore.store.TradePage;
import com.example.tradestore.validation.ValidatorChain;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST binding of the trade document store.
 * Store rejections surface through {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/trades")
@Slf4j
@RequiredArgsConstructor
@Validated
@Tag(name = "Trade Store", description = "Save, load, list and delete trade documents")
public class TradeStoreController {

    private final TradeDocumentStore tradeDocumentStore;
    private final FilterParser filterParser;
    private final ValidatorChain validatorChain;
    private final TradeTemplateFactory tradeTemplateFactory;

    @PostMapping("/save/new")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Save a new trade", description = "Validates the document and stores it as version 1")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Trade created"),
            @ApiResponse(responseCode = "409", description = "A trade with this id already exists"),
            @ApiResponse(responseCode = "422", description = "Context or document validation failed")
    })
    public Mono<SaveTradeResponse> saveNew(@Valid @RequestBody SaveTradeRequest request) {
        log.info("Received save-new request for trade {}", request.id());

        return Mono.fromCallable(() -> tradeDocumentStore.saveNew(request.context(), request.id(), request.trade()))
                .map(SaveTradeResponse::from);
    }

    @PostMapping("/save/update")
    @Operation(summary = "Replace a trade", description = "Validates the new document in full and replaces the stored one")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Trade replaced"),
            @ApiResponse(responseCode = "404", description = "Trade not found"),
            @ApiResponse(responseCode = "409", description = "Stale expected version"),
            @ApiResponse(responseCode = "422", description = "Context or document validation failed")
    })
    public Mono<SaveTradeResponse> saveFullReplace(@Valid @RequestBody SaveTradeRequest request) {
        log.info("Received save-update request for trade {}", request.id());

        return Mono.fromCallable(() -> tradeDocumentStore.saveFullReplace(
                        request.context(), request.id(), request.trade(), request.expectedVersion()))
                .map(SaveTradeResponse::from);
    }

    @PostMapping("/save/partial")
    @Operation(summary = "Partially update a trade",
            description = "Deep-merges the patch onto the stored document and validates the merged result")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Trade updated"),
            @ApiResponse(responseCode = "404", description = "Trade not found"),
            @ApiResponse(responseCode = "409", description = "Stale expected version"),
            @ApiResponse(responseCode = "422", description = "Merged document failed validation")
    })
    public Mono<SaveTradeResponse> savePartial(@Valid @RequestBody PatchTradeRequest request) {
        log.info("Received save-partial request for trade {}", request.id());

        return Mono.fromCallable(() -> tradeDocumentStore.savePartial(
                        request.context(), request.id(), request.patch(), request.expectedVersion()))
                .map(SaveTradeResponse::from);
    }

    @GetMapping("/{tradeId}")
    @Operation(summary = "Get trade by ID", description = "Retrieve a specific trade by its ID")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Trade found"),
            @ApiResponse(responseCode = "404", description = "Trade not found")
    })
    public Mono<TradeRecord> getTradeById(@Parameter(description = "Trade ID") @PathVariable String tradeId) {
        log.debug("Getting trade by ID: {}", tradeId);

        return Mono.fromCallable(() -> tradeDocumentStore.loadById(tradeId));
    }

    @PostMapping("/load/id")
    @Operation(summary = "Load trade by ID")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Trade found"),
            @ApiResponse(responseCode = "404", description = "Trade not found")
    })
    public Mono<TradeRecord> loadById(@Valid @RequestBody TradeIdRequest request) {
        return Mono.fromCallable(() -> tradeDocumentStore.loadById(request.id()));
    }

    @PostMapping("/load/group")
    @Operation(summary = "Load several trades", description = "Unknown ids are listed in missingIds")
    @ApiResponse(responseCode = "200", description = "Trades loaded")
    public Mono<LoadResult> loadByIds(@Valid @RequestBody TradeIdsRequest request) {
        return Mono.fromCallable(() -> tradeDocumentStore.loadByIds(request.ids()));
    }

    @PostMapping("/list")
    @Operation(summary = "List trades matching a filter",
            description = "Filter maps dotted paths to operators: eq, ne, gt, gte, lt, lte, regex, in, nin, exists")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matching trades"),
            @ApiResponse(responseCode = "422", description = "Malformed filter")
    })
    public Mono<ListTradesResponse> list(@Valid @RequestBody ListTradesRequest request) {
        return Mono.fromCallable(() -> {
            TradePage page = tradeDocumentStore.page(toFilter(request));
            log.debug("List returned {} of {} matching trade(s)", page.trades().size(), page.totalMatching());
            return new ListTradesResponse(page.trades(), page.trades().size(), page.totalMatching());
        });
    }

    @PostMapping("/list/count")
    @Operation(summary = "Count trades matching a filter")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Number of matching trades"),
            @ApiResponse(responseCode = "422", description = "Malformed filter")
    })
    public Mono<Map<String, Object>> count(@Valid @RequestBody ListTradesRequest request) {
        return Mono.fromCallable(() -> Map.<String, Object>of("count", tradeDocumentStore.count(toFilter(request))));
    }

    @PostMapping("/delete/id")
    @Operation(summary = "Delete a trade", description = "Idempotent: deleting an unknown id affects nothing")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Delete applied"),
            @ApiResponse(responseCode = "422", description = "Context validation failed")
    })
    public Mono<DeleteResult> deleteById(@Valid @RequestBody TradeIdRequest request) {
        log.info("Received delete request for trade {}", request.id());

        return Mono.fromCallable(() -> {
            int deleted = tradeDocumentStore.deleteById(request.context(), request.id());
            return deleted == 1
                    ? new DeleteResult(1, List.of(request.id()), List.of())
                    : new DeleteResult(0, List.of(), List.of(request.id()));
        });
    }

    @PostMapping("/delete/group")
    @Operation(summary = "Delete several trades", description = "All listed trades are removed in one atomic step")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Delete applied"),
            @ApiResponse(responseCode = "422", description = "Context validation failed")
    })
    public Mono<DeleteResult> deleteByGroup(@Valid @RequestBody TradeIdsRequest request) {
        log.info("Received group delete request for {} trade(s)", request.ids().size());

        return Mono.fromCallable(() -> tradeDocumentStore.deleteByGroup(request.context(), request.ids()));
    }

    @PostMapping("/validate")
    @Operation(summary = "Validate a trade document", description = "Runs the validator chain without storing anything")
    @ApiResponse(responseCode = "200", description = "Validation result, successful or not")
    public Mono<ValidationResult> validate(@RequestBody JsonNode trade) {
        return Mono.fromCallable(() -> validatorChain.validate(trade));
    }

    @GetMapping("/new")
    @Operation(summary = "New trade skeleton", description = "Template document with a provisional id and today's dates")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Skeleton created"),
            @ApiResponse(responseCode = "400", description = "Unknown trade type")
    })
    public Mono<ObjectNode> newTrade(
            @Parameter(description = "ir-swap, commodity-option or index-swap") @RequestParam("type") String type) {
        return Mono.fromCallable(() -> tradeTemplateFactory.newTrade(TradeType.fromCode(type)
                .orElseThrow(() -> new IllegalArgumentException("Unknown trade type: " + type))));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Get store statistics", description = "Trade counts by detected type and operation counts")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully")
    public Mono<Map<String, Object>> getStatistics() {
        log.debug("Getting trade store statistics");

        return Mono.fromCallable(tradeDocumentStore::statistics);
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the trade store is up")
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    public Mono<Map<String, Object>> healthCheck() {
        return Mono.just(Map.of(
                "status", "UP",
                "service", "trade-capture-store",
                "timestamp", System.currentTimeMillis()
        ));
    }

    private TradeFilter toFilter(ListTradesRequest request) {
        return TradeFilter.builder()
                .predicates(filterParser.parse(request.filter()))
                .limit(request.limit())
                .offset(request.offset() == null ? 0 : request.offset())
                .sortBy(request.sortBy())
                .descending(Boolean.TRUE.equals(request.descending()))
                .build();
    }
}
