package org.camunda.bpm.getstarted.migration.analysis.rules;

import java.util.List;

/**
 * The rule catalog. Rules run in list order; the report re-sorts issues afterwards.
 */
public final class MigrationRules {

    private MigrationRules() {
    }

    public static List<MigrationRule> defaultRules() {
        return List.of(
                new NamespaceRule(),
                new ServiceTaskRule(),
                new ScriptTaskRule(),
                new UserTaskRule(),
                new GatewayRule(),
                new EventRule(),
                new ListenerRule(),
                new CallActivityRule(),
                new BusinessRuleTaskRule(),
                new MultiInstanceRule(),
                new SubProcessRule(),
                new InputOutputMappingRule(),
                new EngineConfigurationRule()
        );
    }
}
