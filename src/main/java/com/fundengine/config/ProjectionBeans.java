package com.fundengine.config;

import com.fundengine.projection.ManagementFeeSchedule;
import com.fundengine.projection.StrategyShapeTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the strategy shape table and management fee schedule beans from {@link ProjectionConfig}.
 */
@Configuration
public class ProjectionBeans {

    @Bean
    public StrategyShapeTable strategyShapeTable(ProjectionConfig projectionConfig) {
        return StrategyShapeTable.standard(projectionConfig.getFallbackStrategy());
    }

    @Bean
    public ManagementFeeSchedule managementFeeSchedule(ProjectionConfig projectionConfig) {
        return new ManagementFeeSchedule(
                projectionConfig.getManagementFeeRate(), projectionConfig.getFeeStepDownAfterYears());
    }
}
