package com.cumulo.reference.demodata;

import java.time.LocalDate;
import java.util.Random;
import org.springframework.stereotype.Component;

@Component
class SeededRandomProvider implements RandomProvider {

    private final DemoFactGeneratorProperties properties;

    SeededRandomProvider(DemoFactGeneratorProperties properties) {
        this.properties = properties;
    }

    @Override
    public Random forDay(LocalDate day) {
        Long seed = properties.getSeed();
        if (seed == null) {
            return new Random();
        }
        return new Random(seed ^ day.toEpochDay());
    }
}
