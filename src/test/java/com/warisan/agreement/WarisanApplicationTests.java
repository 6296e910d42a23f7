package com.warisan.agreement;

import com.warisan.agreement.config.WarisanProperties;
import com.warisan.agreement.faraid.AutoFaraidDistributionService;
import com.warisan.agreement.service.AgreementWorkflowService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class WarisanApplicationTests {

    @Autowired
    private WarisanProperties properties;

    @Autowired
    private AgreementWorkflowService workflowService;

    @Autowired
    private AutoFaraidDistributionService distributionService;

    @Autowired
    private Clock clock;

    @Test
    void contextLoads_withProfileOverrides() {
        assertEquals(120, properties.agreement().titleMaxLength());
        assertEquals(1000, properties.agreement().descriptionMaxLength());
        assertEquals(0.01, properties.faraid().totalTolerance());
        assertNotNull(workflowService);
        assertNotNull(distributionService);
        assertNotNull(clock);
    }
}
