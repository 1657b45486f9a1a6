package com.capacityengine.api.controller;

import com.capacityengine.api.dto.BidRequest;
import com.capacityengine.api.dto.ClaimRequest;
import com.capacityengine.api.dto.StartAuctionRequest;
import com.capacityengine.auction.Auction;
import com.capacityengine.auction.AuctionService;
import com.capacityengine.common.OriginResolver;
import com.capacityengine.config.OrderingInterceptor;
import com.capacityengine.subscription.SubscriptionMode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for subscription auctions.
 */
@RestController
@RequestMapping("/api/v1/auctions")
@RequiredArgsConstructor
@Tag(name = "Auctions", description = "Burn-to-win subscription auctions")
public class AuctionController {

    private final AuctionService auctionService;
    private final OriginResolver originResolver;

    @PostMapping
    @Operation(summary = "Start an auction (privileged accounts only)")
    public ResponseEntity<Auction> startAuction(
            @RequestHeader(value = OrderingInterceptor.ACCOUNT_HEADER, required = false) String accountId,
            @Valid @RequestBody StartAuctionRequest request) {
        SubscriptionMode mode = SubscriptionMode.of(request.getKind(), request.getParameter());
        Auction auction = auctionService.startAuction(originResolver.resolve(accountId), mode);
        return ResponseEntity.status(HttpStatus.CREATED).body(auction);
    }

    @GetMapping
    @Operation(summary = "List auctions")
    public ResponseEntity<List<Auction>> getAuctions(@RequestParam(defaultValue = "false") boolean openOnly) {
        return ResponseEntity.ok(auctionService.getAuctions(openOnly));
    }

    @GetMapping("/{auctionId}")
    @Operation(summary = "Get auction details")
    public ResponseEntity<Auction> getAuction(@PathVariable long auctionId) {
        return ResponseEntity.ok(auctionService.getAuction(auctionId));
    }

    @PostMapping("/{auctionId}/bids")
    @Operation(summary = "Place a bid")
    public ResponseEntity<Auction> bid(
            @RequestHeader(value = OrderingInterceptor.ACCOUNT_HEADER, required = false) String accountId,
            @PathVariable long auctionId,
            @Valid @RequestBody BidRequest request) {
        Auction auction = auctionService.bid(originResolver.resolve(accountId), auctionId, request.getAmount());
        return ResponseEntity.ok(auction);
    }

    @PostMapping("/{auctionId}/claim")
    @Operation(summary = "Claim a won auction and issue its subscription")
    public ResponseEntity<Auction> claim(
            @RequestHeader(value = OrderingInterceptor.ACCOUNT_HEADER, required = false) String accountId,
            @PathVariable long auctionId,
            @RequestBody(required = false) ClaimRequest request) {
        String beneficiary = request == null ? null : request.getBeneficiary();
        Auction auction = auctionService.claim(originResolver.resolve(accountId), auctionId, beneficiary);
        return ResponseEntity.ok(auction);
    }
}
