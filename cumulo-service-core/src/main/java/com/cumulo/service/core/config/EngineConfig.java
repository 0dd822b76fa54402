package com.cumulo.service.core.config;

import com.cumulo.service.core.merge.CumulativeMerger;
import com.cumulo.service.core.model.HistoryFormat;
import com.cumulo.service.core.reduced.ReducedArrayAccumulator;
import com.cumulo.service.core.window.WindowMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    public CumulativeMerger cumulativeMerger(CumuloProperties properties) {
        HistoryFormat format = HistoryFormat.fromConfigValue(properties.getHistory().getFormat());
        int width = properties.getBitset().getWidth();
        log.info("Cumulative merger historyFormat={} bitsetWidth={}", format, width);
        return new CumulativeMerger(format, width);
    }

    @Bean
    public ReducedArrayAccumulator reducedArrayAccumulator() {
        return new ReducedArrayAccumulator();
    }

    @Bean
    public WindowMetrics windowMetrics(CumuloProperties properties) {
        return new WindowMetrics(
                properties.getBitset().getWidth(), properties.getWindow().getMonthlyDays());
    }
}
