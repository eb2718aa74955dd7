package com.jasmin.abuseguard.detectors.ratelimiter;

import com.jasmin.abuseguard.constants.Constants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "abuse-guard.rate-limit")
public class RateLimitProperties {

    /** Per-action rules. Entries given in configuration are merged over these defaults. */
    @NotNull
    private Map<String, @Valid ActionRule> actions = defaultActions();

    /** Rule for actions missing from {@link #actions}. */
    @Valid
    @NotNull
    private ActionRule defaultRule = ActionRule.of(100, 3600);

    /** Retry-After handed out when a fail-closed check could not reach the store. */
    @Positive
    private long storageFailureRetryAfterSeconds = 1;

    public ActionRule ruleFor(String action) {
        ActionRule rule = action == null ? null : actions.get(action);
        return rule != null ? rule : defaultRule;
    }

    private static Map<String, ActionRule> defaultActions() {
        Map<String, ActionRule> m = new LinkedHashMap<>();
        m.put("field_create", ActionRule.of(50, 3600));
        m.put("search_query", ActionRule.of(200, 3600));
        m.put("message_send", ActionRule.of(10, 300));
        m.put("profile_view", ActionRule.of(100, 3600));
        m.put("search_request", ActionRule.of(50, 3600));
        m.put("like_action", ActionRule.of(50, 3600));
        m.put("profile_update", ActionRule.of(5, 300));
        m.put("photo_upload", ActionRule.of(10, 3600));
        m.put(Constants.REGISTRATION, ActionRule.failClosed(3, 3600));
        m.put(Constants.LOGIN_ATTEMPT, ActionRule.failClosed(5, 3600));
        m.put(Constants.LOGIN_ACCOUNT, ActionRule.failClosed(3, 1800));
        return m;
    }
}
