package com.learn.pairexchange.web.api;

import com.learn.pairexchange.assets.Asset;
import com.learn.pairexchange.assets.AssetService;
import com.learn.pairexchange.bean.DepositRequestBean;
import com.learn.pairexchange.support.AbstractApiController;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/internal")
public class InternalApiController extends AbstractApiController {

    @Autowired
    AssetService assetService;

    @PostMapping("/deposits")
    public Asset deposit(@RequestBody DepositRequestBean request) {
        request.validate();
        return assetService.deposit(request.accountId, request.asset, request.amount);
    }

    @GetMapping("/{accountId}/assets")
    public Map<String, Asset> getAssets(@PathVariable("accountId") String accountId) {
        return assetService.getAssets(accountId);
    }
}
