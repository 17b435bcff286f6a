package com.quantsim.backend.controller;

import com.quantsim.backend.dto.BacktestRequest;
import com.quantsim.backend.dto.BacktestResponse;
import com.quantsim.backend.service.BacktestService;
import com.quantsim.backend.strategy.StrategyFactory;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/backtest")
@RequiredArgsConstructor
public class BacktestController {

    private final BacktestService backtestService;
    private final StrategyFactory strategyFactory;

    @PostMapping("/run")
    public BacktestResponse run(@Valid @RequestBody BacktestRequest request) {
        return backtestService.runBacktest(request);
    }

    @GetMapping("/strategies")
    public List<String> strategies() {
        return strategyFactory.available();
    }
}
