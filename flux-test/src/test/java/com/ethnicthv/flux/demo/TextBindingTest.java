package com.ethnicthv.flux.demo;

import com.ethnicthv.flux.Flux;
import com.ethnicthv.flux.core.properties.ReactiveProperty;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextBindingTest {

    private Flux flux;
    private List<String> shown;
    private TextBinding binding;

    @BeforeEach
    void setUp() {
        flux = Flux.builder().immediateThreading().build();
        shown = new ArrayList<>();
        binding = new TextBinding(flux.getConverters(), t -> shown.add(t));
    }

    @AfterEach
    void tearDown() {
        binding.close();
        flux.close();
    }

    @Test
    @DisplayName("Existing properties render immediately through the discovered converter")
    void rendersDurationThroughConverter() {
        ReactiveProperty<Duration> time = new ReactiveProperty<>(Duration.class, Duration.ofSeconds(65));
        flux.getProperties().registerProperty(PlayerKeys.SESSION_TIME, time, true);

        binding.bind(flux.getProperties(), PlayerKeys.SESSION_TIME);

        assertTrue(binding.isActive());
        assertEquals("1:05", binding.getText());
        time.setValue(Duration.ofSeconds(600));
        assertEquals(List.of("1:05", "10:00"), shown);
    }

    @Test
    @DisplayName("Edits are parsed back into the property type")
    void submitParsesBack() {
        ReactiveProperty<Duration> time = new ReactiveProperty<>(Duration.class, Duration.ZERO);
        flux.getProperties().registerProperty(PlayerKeys.SESSION_TIME, time);
        binding.bind(flux.getProperties(), PlayerKeys.SESSION_TIME);

        assertTrue(binding.submit("2:30"));
        assertEquals(Duration.ofSeconds(150), time.getValue());
        assertEquals("2:30", binding.getText());
    }

    @Test
    @DisplayName("Types without a converter fall back to plain text and reject foreign edits")
    void fallsBackWithoutConverter() {
        ReactiveProperty<Long> score = flux.getProperties().getOrCreateProperty("player.score", 12L);
        binding.bind(flux.getProperties(), "player.score");

        assertEquals("12", binding.getText());
        assertFalse(binding.submit("13"));
        assertEquals(12L, score.getValue());
    }

    @Test
    @DisplayName("Unbound bindings ignore edits and later registrations")
    void unboundBindingIsInert() {
        binding.bind(flux.getProperties(), PlayerKeys.HEALTH);
        binding.unbind();

        flux.getProperties().getOrCreateProperty(PlayerKeys.HEALTH, 100);

        assertFalse(binding.isActive());
        assertFalse(binding.submit("5"));
        assertTrue(shown.isEmpty());
    }

    @Test
    @DisplayName("Rebinding moves the binding to the new key")
    void rebindSwitchesProperty() {
        ReactiveProperty<Integer> health = flux.getProperties().getOrCreateProperty(PlayerKeys.HEALTH, 100);
        ReactiveProperty<Integer> max = flux.getProperties().getOrCreateProperty(PlayerKeys.MAX_HEALTH, 150);

        binding.bind(flux.getProperties(), PlayerKeys.HEALTH);
        binding.bind(flux.getProperties(), PlayerKeys.MAX_HEALTH);
        health.setValue(1);

        assertEquals("150", binding.getText());
        assertFalse(health.hasSubscribers());
        assertTrue(max.hasSubscribers());
    }
}
