package com.trading.flowgen;

import com.trading.flowgen.api.GenerationHistory;
import com.trading.flowgen.api.TemplateLookup;
import com.trading.flowgen.codegen.CodeGenerationRecord;
import com.trading.flowgen.codegen.CodeGenerator;
import com.trading.flowgen.codegen.GenerationRequest;
import com.trading.flowgen.graph.FlowIssue;
import com.trading.flowgen.graph.FlowValidationResult;
import com.trading.flowgen.graph.LogicFlowValidator;
import com.trading.flowgen.graph.StrategyRules;
import com.trading.flowgen.io.FlowGenConfig;
import com.trading.flowgen.io.InMemoryGenerationHistory;
import com.trading.flowgen.io.TemplateCatalogLoader;
import com.trading.flowgen.param.ParameterValidationResult;
import com.trading.flowgen.param.ParameterValidator;
import com.trading.flowgen.security.CodeValidator;
import com.trading.flowgen.security.SecurityPolicy;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Strategy generation pipeline.
 *
 * <ol>
 * <li>Validate the logic flow; reject on any error.</li>
 * <li>Validate every node's parameters against its template; reject on any error.</li>
 * <li>When {@link FlowGenConfig#isEnforceStrategyRules()} is set, check the
 * {@link StrategyRules}; reject on any error.</li>
 * <li>Generate the module.</li>
 * <li>Return the existing record if this instance already produced identical code.</li>
 * <li>Run the syntax and security checks and save the record.</li>
 * </ol>
 *
 * Steps 4 and 5 are a read-then-write on the history; callers that generate
 * concurrently for one instance should go through
 * {@link com.trading.flowgen.wiring.GenerationPublisher}.
 */
@Log4j2
public final class StrategyBuilder {
    private final TemplateLookup templates;
    private final GenerationHistory history;
    private final LogicFlowValidator flowValidator;
    private final ParameterValidator parameterValidator = new ParameterValidator();
    private final CodeGenerator generator;
    private final CodeValidator codeValidator;
    private final StrategyRules strategyRules;

    public StrategyBuilder(TemplateLookup templates, GenerationHistory history, SecurityPolicy policy,
            FlowGenConfig config) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.history = Objects.requireNonNull(history, "history");
        this.flowValidator = new LogicFlowValidator(config.getMaxNodes(), config.getMaxEdges());
        this.generator = new CodeGenerator(config.getStrategyClassName());
        this.codeValidator = new CodeValidator(policy);
        this.strategyRules = config.isEnforceStrategyRules() ? new StrategyRules() : null;
    }

    public StrategyBuilder(TemplateLookup templates, GenerationHistory history) {
        this(templates, history, SecurityPolicy.defaults(), new FlowGenConfig());
    }

    /** Bundled catalog and policy, configured from {@code flowgen.json}, with an in-memory history. */
    public static StrategyBuilder withDefaults() {
        FlowGenConfig config = FlowGenConfig.load();
        return new StrategyBuilder(
                new TemplateCatalogLoader().loadResource(config.getTemplateCatalog()),
                new InMemoryGenerationHistory(),
                SecurityPolicy.fromResource(config.getSecurityPolicy()),
                config);
    }

    /**
     * Runs the pipeline for one request.
     *
     * @throws com.trading.flowgen.codegen.CodeGenerationException if a template cannot be rendered
     */
    public GenerationOutcome build(GenerationRequest request) {
        log.debug("Building strategy for instance {}", request.instanceId());

        FlowValidationResult flow = flowValidator.validate(request.flow(), templates);
        if (!flow.isValid()) {
            log.info("Instance {} rejected: {} flow error(s)", request.instanceId(), flow.errors().size());
            return GenerationOutcome.rejected(flow, Map.of());
        }

        Map<String, ParameterValidationResult> params =
                parameterValidator.validateFlow(request.flow(), request.parameters(), templates);
        if (!params.isEmpty()) {
            log.info("Instance {} rejected: invalid parameters on node(s) {}", request.instanceId(),
                    params.keySet());
            return GenerationOutcome.rejected(flow, params);
        }

        if (strategyRules != null) {
            List<FlowIssue> broken = strategyRules.check(request.flow(), request.parameters(), templates);
            if (!broken.isEmpty()) {
                log.info("Instance {} rejected: {} strategy rule error(s)", request.instanceId(), broken.size());
                return GenerationOutcome.rejected(
                        new FlowValidationResult(broken, flow.warnings(), flow.metadata()), Map.of());
            }
        }

        CodeGenerationRecord generated = generator.generate(request, templates);

        Optional<CodeGenerationRecord> existing = history.findByHash(request.instanceId(), generated.getCodeHash());
        if (existing.isPresent()) {
            log.info("Instance {} reuses record {} (hash {})", request.instanceId(), existing.get().getId(),
                    generated.getCodeHash().substring(0, 12));
            return GenerationOutcome.generated(flow, existing.get(), true);
        }

        CodeGenerationRecord validated = codeValidator.validate(generated);
        CodeGenerationRecord saved = history.save(validated);
        return GenerationOutcome.generated(flow, saved, false);
    }

    public TemplateLookup templates() {
        return templates;
    }

    public GenerationHistory history() {
        return history;
    }
}
