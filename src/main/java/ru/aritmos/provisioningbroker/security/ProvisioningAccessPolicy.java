package ru.aritmos.provisioningbroker.security;

import io.micronaut.http.HttpMethod;
import io.micronaut.security.authentication.Authentication;
import jakarta.inject.Singleton;
import ru.aritmos.provisioningbroker.config.ProvisioningBrokerSecurityProperties;

import java.util.Collection;

/**
 * Определяет, какая роль нужна для обращения к HTTP API брокера.
 * <p>
 * Разметка:
 * <ul>
 *   <li>/health, /info: без аутентификации;</li>
 *   <li>/api/provisioning/**: задания и учётные данные арендаторов, роль оператора;</li>
 *   <li>GET /admin/runtime-config/**: чтение конфигурации и аудита, оператор (если разрешено настройкой);</li>
 *   <li>прочие запросы к /admin/** и любые неизвестные пути: администратор.</li>
 * </ul>
 * В режиме OPEN аутентификация не требуется нигде.
 */
@Singleton
public class ProvisioningAccessPolicy {

    static final String JOBS_PREFIX = "/api/provisioning";
    static final String RUNTIME_CONFIG_PREFIX = "/admin/runtime-config";

    public enum Requirement {
        PUBLIC,
        OPERATOR,
        ADMIN
    }

    public Requirement requirementFor(HttpMethod method, String path, ProvisioningBrokerSecurityProperties props) {
        ProvisioningBrokerSecurityProperties effective = props == null
                ? new ProvisioningBrokerSecurityProperties()
                : props;
        if (effective.getMode() == ProvisioningBrokerSecurityProperties.Mode.OPEN) {
            return Requirement.PUBLIC;
        }
        String p = normalize(path);
        if (p == null) {
            return Requirement.ADMIN;
        }
        if (under(p, "/health") || under(p, "/info")) {
            return Requirement.PUBLIC;
        }
        if (under(p, JOBS_PREFIX)) {
            return Requirement.OPERATOR;
        }
        if (under(p, RUNTIME_CONFIG_PREFIX) && method == HttpMethod.GET && effective.isOperatorsReadConfig()) {
            return Requirement.OPERATOR;
        }
        return Requirement.ADMIN;
    }

    /**
     * Администратор удовлетворяет любому требованию, оператор только требованию OPERATOR.
     */
    public boolean satisfies(Authentication authentication, Requirement requirement) {
        if (requirement == Requirement.PUBLIC) {
            return true;
        }
        if (authentication == null) {
            return false;
        }
        Collection<String> roles = authentication.getRoles();
        if (roles == null || roles.isEmpty()) {
            return false;
        }
        if (roles.contains(ProvisioningRoles.ADMIN)) {
            return true;
        }
        return requirement == Requirement.OPERATOR && roles.contains(ProvisioningRoles.OPERATOR);
    }

    static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        String p = path.trim();
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    private static boolean under(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }
}
