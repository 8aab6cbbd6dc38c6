package com.phillippitts.coordsim.config.orchestration;

import com.phillippitts.coordsim.service.collaborator.ComplianceValidator;
import com.phillippitts.coordsim.service.collaborator.CoordinateAnalyzer;
import com.phillippitts.coordsim.service.collaborator.Collaborators;
import com.phillippitts.coordsim.service.collaborator.PersonaCalibrator;
import com.phillippitts.coordsim.service.collaborator.SimulationRunner;
import com.phillippitts.coordsim.service.orchestration.DefaultSimulationOrchestrator;
import com.phillippitts.coordsim.service.orchestration.ResultCompiler;
import com.phillippitts.coordsim.service.orchestration.ResultOptimizer;
import com.phillippitts.coordsim.service.orchestration.SimulationMetricsPublisher;
import com.phillippitts.coordsim.service.orchestration.SimulationOrchestrator;
import com.phillippitts.coordsim.service.orchestration.StageExecutor;
import com.phillippitts.coordsim.service.session.SessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the simulation orchestrator and its optional collaborators.
 *
 * <p>Each collaborator bean is optional. Missing ones are passed as null and their stages
 * degrade to no-ops.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestrationConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Groups whichever collaborator beans are present.
     */
    @Bean
    public Collaborators collaborators(ObjectProvider<CoordinateAnalyzer> coordinateAnalyzer,
                                       ObjectProvider<PersonaCalibrator> personaCalibrator,
                                       ObjectProvider<SimulationRunner> simulationRunner,
                                       ObjectProvider<ComplianceValidator> complianceValidator) {
        Collaborators collaborators = new Collaborators(
                coordinateAnalyzer.getIfAvailable(),
                personaCalibrator.getIfAvailable(),
                simulationRunner.getIfAvailable(),
                complianceValidator.getIfAvailable());
        LOG.info("Workflow collaborators: {}", collaborators.availability());
        return collaborators;
    }

    @Bean
    public SimulationOrchestrator simulationOrchestrator(SessionRegistry registry,
                                                         StageExecutor stageExecutor,
                                                         ResultCompiler compiler,
                                                         ResultOptimizer optimizer,
                                                         ApplicationEventPublisher publisher,
                                                         SimulationMetricsPublisher metricsPublisher,
                                                         Clock clock) {
        return new DefaultSimulationOrchestrator(registry, stageExecutor, compiler, optimizer,
                publisher, metricsPublisher, clock);
    }
}
