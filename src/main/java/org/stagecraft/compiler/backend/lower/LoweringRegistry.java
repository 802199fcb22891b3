package org.stagecraft.compiler.backend.lower;

import org.stagecraft.compiler.api.EmitOptions;
import org.stagecraft.compiler.backend.lower.features.CoverageInstrumentationRule;
import org.stagecraft.compiler.backend.lower.features.NopEliminationRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registry for lowering rules applied in order.
 */
public final class LoweringRegistry {

    private final List<ILoweringRule> rules = new ArrayList<>();

    /**
     * Registers a new lowering rule.
     * @param rule The rule to register.
     */
    public void register(ILoweringRule rule) {
        rules.add(rule);
    }

    /**
     * @return The list of registered lowering rules.
     */
    public List<ILoweringRule> rules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Initializes a new lowering registry with the default rules for the given options.
     * @param options The emit options of the run.
     * @return A new registry with default rules.
     */
    public static LoweringRegistry initializeWithDefaults(EmitOptions options) {
        LoweringRegistry reg = new LoweringRegistry();
        reg.register(new NopEliminationRule());
        if (options.emitTestCoverageData()) {
            reg.register(new CoverageInstrumentationRule());
        }
        return reg;
    }
}
