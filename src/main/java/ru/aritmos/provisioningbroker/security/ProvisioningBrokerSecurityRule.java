package ru.aritmos.provisioningbroker.security;

import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.http.HttpRequest;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.rules.SecuredAnnotationRule;
import io.micronaut.security.rules.SecurityRule;
import io.micronaut.security.rules.SecurityRuleResult;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.config.ProvisioningBrokerSecurityProperties;

/**
 * Правило доступа к API брокера по ролям оператора и администратора.
 *
 * <p>Применяется до аннотационных правил @Secured и выносит окончательное решение:
 * запрос либо разрешается, либо отклоняется. Аннотации на контроллерах дублируют ту же разметку.
 */
@Singleton
public class ProvisioningBrokerSecurityRule implements SecurityRule<HttpRequest<?>> {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningBrokerSecurityRule.class);

    private final ProvisioningBrokerSecurityProperties securityProperties;
    private final ProvisioningAccessPolicy policy;

    public ProvisioningBrokerSecurityRule(ProvisioningBrokerSecurityProperties securityProperties,
                                          ProvisioningAccessPolicy policy) {
        this.securityProperties = securityProperties;
        this.policy = policy;
    }

    @Override
    public Publisher<SecurityRuleResult> check(HttpRequest<?> request, Authentication authentication) {
        if (request == null) {
            return Publishers.just(SecurityRuleResult.REJECTED);
        }
        ProvisioningAccessPolicy.Requirement requirement =
                policy.requirementFor(request.getMethod(), request.getPath(), securityProperties);
        if (policy.satisfies(authentication, requirement)) {
            return Publishers.just(SecurityRuleResult.ALLOWED);
        }
        if (authentication != null) {
            log.warn("Доступ запрещён: {} {} требует роль {}, у пользователя '{}' роли {}",
                    request.getMethod(), request.getPath(), requirement, authentication.getName(), authentication.getRoles());
        }
        return Publishers.just(SecurityRuleResult.REJECTED);
    }

    @Override
    public int getOrder() {
        return SecuredAnnotationRule.ORDER - 10;
    }
}
