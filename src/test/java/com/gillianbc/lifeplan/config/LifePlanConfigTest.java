package com.gillianbc.lifeplan.config;

import com.gillianbc.lifeplan.dispatch.ProjectionDispatcher;
import com.gillianbc.lifeplan.model.Income;
import com.gillianbc.lifeplan.model.Profile;
import com.gillianbc.lifeplan.model.Trajectory;
import com.gillianbc.lifeplan.service.ComparisonService;
import com.gillianbc.lifeplan.service.TrajectoryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(classes = LifePlanConfig.class)
class LifePlanConfigTest {

    @Autowired
    private TrajectoryService trajectoryService;

    @Autowired
    private ComparisonService comparisonService;

    @Autowired
    private ProjectionDispatcher dispatcher;

    @Autowired
    private ProjectionProperties properties;

    @Test
    @DisplayName("Properties bind from application.properties")
    void properties_bound() {
        assertEquals(10, properties.getQuickYears());
        assertEquals(7, properties.getNetWorthThresholds().size());
        assertEquals(0, new BigDecimal("2080").compareTo(properties.getInsight().getWorkHoursThreshold()));
    }

    @Test
    @DisplayName("Wired services project a profile end to end")
    void services_wired() {
        Profile profile = Profile.builder()
                .id("wired")
                .income(Income.builder().id("s").name("Salary").amount(new BigDecimal("70000")).build())
                .build();
        Trajectory trajectory = trajectoryService.generateQuickTrajectory(profile);
        assertEquals(10, trajectory.getYears().size());
        assertNotNull(comparisonService);
        assertNotNull(dispatcher);
    }
}
