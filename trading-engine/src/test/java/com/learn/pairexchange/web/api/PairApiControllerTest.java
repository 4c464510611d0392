package com.learn.pairexchange.web.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.learn.pairexchange.assets.AssetService;
import com.learn.pairexchange.clearing.ClearingService;
import com.learn.pairexchange.match.MatchEngine;
import com.learn.pairexchange.pair.TradingPairService;
import com.learn.pairexchange.util.JsonUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class PairApiControllerTest {

    MockMvc mockMvc;

    @BeforeEach
    void setup() throws Exception {
        AssetService assetService = new AssetService();
        TradingPairService tradingPairService = new TradingPairService(assetService, new MatchEngine(),
                new ClearingService(assetService));
        PairApiController pairApiController = new PairApiController();
        pairApiController.tradingPairService = tradingPairService;
        pairApiController.orderBookDepth = 100;
        InternalApiController internalApiController = new InternalApiController();
        internalApiController.assetService = assetService;
        this.mockMvc = MockMvcBuilders.standaloneSetup(pairApiController, internalApiController).build();

        postJson("/api/pairs", null, Map.of("baseAsset", "A", "quoteAsset", "B"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pairId").value(1))
                .andExpect(jsonPath("$.custodyAccount").value("pair-1"));
        postJson("/internal/deposits", null, Map.of("accountId", "alice", "asset", "A", "amount", 100))
                .andExpect(status().isOk());
        postJson("/internal/deposits", null, Map.of("accountId", "bob", "asset", "B", "amount", 100))
                .andExpect(status().isOk());
    }

    @Test
    void submitCrossingOrders() throws Exception {
        postJson("/api/pairs/1/bids", "alice", order("alice", 40, 100))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orderId").value(1))
                .andExpect(jsonPath("$.direction").value("BID"))
                .andExpect(jsonPath("$.matchDetails.length()").value(0));
        postJson("/api/pairs/1/asks", "bob", order("bob", 2, 100))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matchDetails.length()").value(1))
                .andExpect(jsonPath("$.matchDetails[0].price").value(2))
                .andExpect(jsonPath("$.matchDetails[0].baseQuantity").value(50))
                .andExpect(jsonPath("$.matchDetails[0].quoteQuantity").value(100))
                .andExpect(jsonPath("$.matchDetails[0].askBeneficiary").value("bob"));

        mockMvc.perform(get("/api/pairs/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bidCount").value(1))
                .andExpect(jsonPath("$.askCount").value(0))
                .andExpect(jsonPath("$.basePool").value(50))
                .andExpect(jsonPath("$.bestBid").value(40));

        String bids = mockMvc.perform(get("/api/pairs/1/bids"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        List<Map<String, Object>> offers = JsonUtil.readJson(bids, new TypeReference<>() {});
        assertEquals(1, offers.size());
        assertEquals(50, ((Number) offers.get(0).get("quantity")).intValue());

        mockMvc.perform(get("/internal/alice/assets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.B.available").value(100))
                .andExpect(jsonPath("$.A.available").value(0));
    }

    @Test
    void rejectZeroQuantity() throws Exception {
        postJson("/api/pairs/1/bids", "alice", order("alice", 40, 0))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ZERO_QUANTITY"));
        mockMvc.perform(get("/api/pairs/1"))
                .andExpect(jsonPath("$.bidCount").value(0))
                .andExpect(jsonPath("$.basePool").value(0));
    }

    @Test
    void rejectInvalidRequests() throws Exception {
        postJson("/api/pairs/1/bids", null, order("alice", 40, 1))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("PARAMETER_INVALID"));
        postJson("/api/pairs/1/bids", "alice",
                Map.of("beneficiary", "alice", "price", new BigInteger("18446744073709551616"), "quantity", 1))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data").value("price"));
        postJson("/api/pairs/9/asks", "bob", order("bob", 2, 1))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("PAIR_NOT_FOUND"));
        postJson("/api/pairs/1/bids", "carol", order("carol", 2, 1))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("NO_ENOUGH_ASSET"));
        mockMvc.perform(get("/api/pairs/1/asks").param("maxDepth", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data").value("maxDepth"));
    }

    @Test
    void acceptMaxUint64Price() throws Exception {
        postJson("/api/pairs/1/bids", "alice",
                Map.of("beneficiary", "alice", "price", new BigInteger("18446744073709551615"), "quantity", 1))
                .andExpect(status().isOk());
        String pair = mockMvc.perform(get("/api/pairs/1"))
                .andReturn().getResponse().getContentAsString();
        Map<String, Object> bean = JsonUtil.readJson(pair, new TypeReference<>() {});
        assertEquals(new BigInteger("18446744073709551615"), new BigInteger(bean.get("bestBid").toString()));
    }

    @Test
    void listPairs() throws Exception {
        postJson("/api/pairs", null, Map.of("baseAsset", "A", "quoteAsset", "B"))
                .andExpect(jsonPath("$.pairId").value(2));
        postJson("/api/pairs", null, Map.of("baseAsset", "A", "quoteAsset", "A"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/pairs").param("base", "A").param("quote", "B"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    Map<String, Object> order(String beneficiary, long price, long quantity) {
        return Map.of("beneficiary", beneficiary, "price", price, "quantity", quantity);
    }

    ResultActions postJson(String url, String caller, Object body) throws Exception {
        var request = post(url).contentType(MediaType.APPLICATION_JSON).content(JsonUtil.writeJson(body));
        if(caller != null)
            request.header("X-Account-Id", caller);
        return mockMvc.perform(request);
    }
}
