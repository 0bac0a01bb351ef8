package com.platform.scaffold.config;

import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

import java.util.Map;

/**
 * Evaluates {@link ConditionalOnFeature} against {@link FeatureFlags#resolve}.
 */
class FeatureCondition extends SpringBootCondition {
    
    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        Map<String, Object> attributes = metadata.getAnnotationAttributes(ConditionalOnFeature.class.getName());
        if (attributes == null) {
            return ConditionOutcome.noMatch("@ConditionalOnFeature not present");
        }
        
        Feature feature = (Feature) attributes.get("value");
        boolean expected = (Boolean) attributes.get("enabled");
        boolean actual = FeatureFlags.resolve(new EnvResolver(context.getEnvironment())).isEnabled(feature);
        
        String message = "feature " + feature + " is " + (actual ? "enabled" : "disabled");
        return actual == expected ? ConditionOutcome.match(message) : ConditionOutcome.noMatch(message);
    }
}
