package com.phillippitts.servicegraph.service.validation;

import com.phillippitts.servicegraph.config.properties.ValidationProperties;
import com.phillippitts.servicegraph.domain.DatabaseConfig;
import com.phillippitts.servicegraph.domain.IssueCode;
import com.phillippitts.servicegraph.domain.ServiceInstance;
import com.phillippitts.servicegraph.domain.ServiceMode;
import com.phillippitts.servicegraph.domain.SslConfig;
import com.phillippitts.servicegraph.domain.ValidationIssue;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks field-level invariants across all enabled service instances: port range and
 * uniqueness, data-directory uniqueness and form, domain format, database credentials and TLS
 * consistency, plus advisory warnings for common misconfigurations.
 *
 * <p>Independent of the dependency graph. Every rule runs over every instance; the validator
 * never stops at the first issue. Uniqueness rules report one issue per colliding pair, naming
 * both services.
 */
@Component
public class CrossServiceValidator {

    static final int MIN_PORT = 1024;
    static final int MAX_PORT = 65535;

    private static final Pattern DOMAIN_PATTERN = Pattern.compile("^[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private final ValidationProperties props;

    public CrossServiceValidator(ValidationProperties props) {
        this.props = props;
    }

    /**
     * Validates the enabled instances.
     *
     * @param instances enabled instances, in the order issues should be reported
     * @return fatal issues and warnings, grouped by rule
     */
    public List<ValidationIssue> validate(List<ServiceInstance> instances) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ServiceInstance instance : instances) {
            checkPortRange(instance, issues);
        }
        checkPortUniqueness(instances, issues);
        checkDataDirUniqueness(instances, issues);
        for (ServiceInstance instance : instances) {
            checkDataDirAbsolute(instance, issues);
            checkDomainFormat(instance, issues);
            checkDatabase(instance, issues);
            checkSsl(instance, issues);
        }
        for (ServiceInstance instance : instances) {
            warnDevModeDomain(instance, issues);
            warnPlaceholderDomain(instance, issues);
            warnUnencryptedDatabase(instance, issues);
            warnSslDisabledInProd(instance, issues);
        }
        return issues;
    }

    private void checkPortRange(ServiceInstance instance, List<ValidationIssue> issues) {
        int port = instance.port();
        if (port >= MIN_PORT && port <= MAX_PORT) {
            return;
        }
        if (port > 0 && port < MIN_PORT && props.isPrivilegedPortGranted(instance.name(), port)) {
            return;
        }
        issues.add(ValidationIssue.of(IssueCode.PORT_OUT_OF_RANGE, instance.name(),
                "Service '" + instance.name() + "' main port " + port + " must be between "
                        + MIN_PORT + "-" + MAX_PORT + " (non-privileged range)"));
    }

    private void checkPortUniqueness(List<ServiceInstance> instances, List<ValidationIssue> issues) {
        Map<Integer, List<String>> seen = new LinkedHashMap<>();
        for (ServiceInstance instance : instances) {
            List<String> owners = seen.computeIfAbsent(instance.port(), p -> new ArrayList<>());
            for (String owner : owners) {
                issues.add(ValidationIssue.of(IssueCode.PORT_COLLISION, instance.name(),
                        "Port " + instance.port() + " is already used by service '" + owner
                                + "', cannot assign to '" + instance.name() + "'"));
            }
            owners.add(instance.name());
        }
    }

    private void checkDataDirUniqueness(List<ServiceInstance> instances, List<ValidationIssue> issues) {
        Map<String, List<String>> seen = new LinkedHashMap<>();
        for (ServiceInstance instance : instances) {
            List<String> owners = seen.computeIfAbsent(normalize(instance.dataDir()), d -> new ArrayList<>());
            for (String owner : owners) {
                issues.add(ValidationIssue.of(IssueCode.DATA_DIR_COLLISION, instance.name(),
                        "Data directory '" + instance.dataDir() + "' is already used by service '" + owner
                                + "', cannot assign to '" + instance.name() + "'"));
            }
            owners.add(instance.name());
        }
    }

    private void checkDataDirAbsolute(ServiceInstance instance, List<ValidationIssue> issues) {
        if (!instance.dataDir().startsWith("/")) {
            issues.add(ValidationIssue.of(IssueCode.RELATIVE_DATA_DIR, instance.name(),
                    "Service '" + instance.name() + "' dataDir path '" + instance.dataDir()
                            + "' should be absolute and valid"));
        }
    }

    private void checkDomainFormat(ServiceInstance instance, List<ValidationIssue> issues) {
        if (instance.domain() == null) {
            return;
        }
        if (!DOMAIN_PATTERN.matcher(instance.domain()).matches()) {
            issues.add(ValidationIssue.of(IssueCode.INVALID_DOMAIN_FORMAT, instance.name(),
                    "Service '" + instance.name() + "' domain '" + instance.domain()
                            + "' is not a valid domain name format"));
        }
    }

    private void checkDatabase(ServiceInstance instance, List<ValidationIssue> issues) {
        DatabaseConfig database = instance.database();
        if (database == null) {
            return;
        }
        if (database.type().isNetworked() && !database.hasPasswordFile()) {
            issues.add(ValidationIssue.of(IssueCode.MISSING_DATABASE_CREDENTIAL, instance.name(),
                    "Service '" + instance.name() + "' database type '" + typeName(database)
                            + "' requires passwordFile to be set"));
        }
    }

    private void checkSsl(ServiceInstance instance, List<ValidationIssue> issues) {
        SslConfig ssl = instance.ssl();
        if (ssl == null || !ssl.enabled() || ssl.usesAcme()) {
            return;
        }
        if (!ssl.hasCertificateFiles()) {
            issues.add(ValidationIssue.of(IssueCode.INCONSISTENT_SSL_CONFIG, instance.name(),
                    "Service '" + instance.name()
                            + "' SSL enabled without ACME requires both certificate and certificateKey paths"));
        }
    }

    private void warnDevModeDomain(ServiceInstance instance, List<ValidationIssue> issues) {
        if (instance.mode() != ServiceMode.DEV || !instance.hasDomain()) {
            return;
        }
        String domain = instance.domain().toLowerCase(Locale.ROOT);
        for (String suffix : props.getProductionDomainSuffixes()) {
            if (domain.endsWith(suffix.toLowerCase(Locale.ROOT))) {
                issues.add(ValidationIssue.of(IssueCode.DEV_MODE_WITH_PROD_LIKE_DOMAIN, instance.name(),
                        "Service '" + instance.name() + "' is in dev mode but domain '" + instance.domain()
                                + "' looks like production"));
                return;
            }
        }
    }

    private void warnPlaceholderDomain(ServiceInstance instance, List<ValidationIssue> issues) {
        if (!instance.hasDomain()) {
            return;
        }
        String domain = instance.domain().toLowerCase(Locale.ROOT);
        for (String placeholder : props.getPlaceholderDomains()) {
            if (domain.contains(placeholder.toLowerCase(Locale.ROOT))) {
                issues.add(ValidationIssue.of(IssueCode.DEFAULT_DOMAIN_UNCHANGED, instance.name(),
                        "Service '" + instance.name() + "' is using default domain '" + instance.domain()
                                + "', should be changed for production"));
                return;
            }
        }
    }

    private void warnUnencryptedDatabase(ServiceInstance instance, List<ValidationIssue> issues) {
        DatabaseConfig database = instance.database();
        if (database == null || !database.type().isNetworked()) {
            return;
        }
        if (!props.getLocalDatabaseHosts().contains(database.host())) {
            issues.add(ValidationIssue.of(IssueCode.UNENCRYPTED_DATABASE_LINK, instance.name(),
                    "Service '" + instance.name() + "' database connection to '" + database.host()
                            + "' should use encryption"));
        }
    }

    private void warnSslDisabledInProd(ServiceInstance instance, List<ValidationIssue> issues) {
        SslConfig ssl = instance.ssl();
        if (instance.mode() == ServiceMode.PROD && ssl != null && !ssl.enabled()) {
            issues.add(ValidationIssue.of(IssueCode.SSL_DISABLED_IN_PROD, instance.name(),
                    "Service '" + instance.name() + "' has SSL disabled in production mode - security risk"));
        }
    }

    private static String typeName(DatabaseConfig database) {
        return database.type().name().toLowerCase(Locale.ROOT);
    }

    /**
     * Collapses redundant separators and dot segments so that equivalent spellings of the same
     * directory collide.
     */
    static String normalize(String dataDir) {
        try {
            return Paths.get(dataDir).normalize().toString();
        } catch (InvalidPathException e) {
            // Unparseable paths are compared verbatim
            return dataDir;
        }
    }
}
