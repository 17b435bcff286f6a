package com.quantsim.backend.strategy;

import com.quantsim.backend.exception.BadRequestException;
import com.quantsim.backend.model.PortfolioState;
import com.quantsim.backend.model.Side;
import com.quantsim.backend.model.Signal;
import com.quantsim.backend.util.TestBarFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyFactoryTest {

    private final StrategyFactory factory = new StrategyFactory();

    @Test
    void createsFreshInstancesByName() {
        Strategy first = factory.create("ma-cross");
        Strategy second = factory.create(" MA-Cross ");

        assertThat(first).isInstanceOf(MovingAverageCrossStrategy.class);
        assertThat(second).isNotSameAs(first);
        assertThat(factory.create("buy-and-hold")).isInstanceOf(BuyAndHoldStrategy.class);
        assertThat(factory.available()).containsExactly("ma-cross", "buy-and-hold");
    }

    @Test
    void unknownOrMissingNameIsBadRequest() {
        assertThatThrownBy(() -> factory.create("martingale")).isInstanceOf(BadRequestException.class)
                .hasMessageContaining("martingale");
        assertThatThrownBy(() -> factory.create(" ")).isInstanceOf(BadRequestException.class);
    }

    @Test
    void buyAndHoldStopsAfterFirstFill() {
        Strategy strategy = factory.create("buy-and-hold");
        PortfolioState portfolio = new PortfolioState(1_000, Map.of(), List.of());

        Signal signal = strategy.generateSignal(TestBarFactory.bar(0, 100), portfolio);
        assertThat(signal.getSide()).isEqualTo(Side.BUY);
        assertThat(strategy.generateSignal(TestBarFactory.bar(1, 100), portfolio)).isNotNull();

        strategy.onFill(signal);

        assertThat(strategy.generateSignal(TestBarFactory.bar(2, 100), portfolio)).isNull();
    }
}
