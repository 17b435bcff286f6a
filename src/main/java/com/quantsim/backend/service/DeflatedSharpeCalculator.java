package com.quantsim.backend.service;

import org.springframework.stereotype.Service;

/**
 * Haircut on a Sharpe ratio for the number of strategy variants tried before
 * picking this one: {@code sharpe - sqrt(2 ln(trials) / (n - 1))}.
 */
@Service
public class DeflatedSharpeCalculator {

    public double deflate(double sharpe, int sampleSize, int trials) {
        if (sampleSize <= 1 || trials <= 1) {
            return sharpe;
        }
        double penalty = Math.sqrt(2.0 * Math.log(trials) / (sampleSize - 1));
        return sharpe - penalty;
    }
}
