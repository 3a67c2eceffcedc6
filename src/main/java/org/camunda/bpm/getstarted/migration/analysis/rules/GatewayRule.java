package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.expression.ExpressionSyntaxValidator;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

import java.util.List;

/**
 * Gateways: outgoing flow conditions and the gateway kinds Camunda 8 handles differently.
 */
public class GatewayRule implements MigrationRule {
    static final String CATEGORY = "Gateway";

    static final List<String> GATEWAY_TYPES = List.of(
            "exclusiveGateway", "parallelGateway", "inclusiveGateway", "eventBasedGateway", "complexGateway");

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (String gatewayType : GATEWAY_TYPES) {
            for (ElementRef gateway : model.findAll(gatewayType)) {
                checkOutgoingConditions(model, gateway, context);

                if ("complexGateway".equals(gatewayType)) {
                    context.addIssue(Severity.CRITICAL, CATEGORY, gateway,
                            "Complex gateway not supported in Camunda 8",
                            "Consider redesigning using exclusive or parallel gateways.");
                }
                if ("eventBasedGateway".equals(gatewayType)) {
                    context.addIssue(Severity.WARNING, CATEGORY, gateway,
                            "Event-based gateway behavior may differ",
                            "Review event correlation and timing in Camunda 8.");
                }
            }
        }
    }

    private void checkOutgoingConditions(ElementModel model, ElementRef gateway, AnalysisContext context) {
        for (ElementRef outgoing : gateway.children("outgoing")) {
            outgoing.text().ifPresent(flowId -> model.findById("sequenceFlow", flowId)
                    .flatMap(flow -> flow.child("conditionExpression"))
                    .flatMap(ElementRef::text)
                    .ifPresent(condition -> ExpressionSyntaxValidator.validate(condition, gateway,
                            "gateway condition on flow " + flowId, context)));
        }
    }

    @Override
    public String name() {
        return "gateways";
    }
}
