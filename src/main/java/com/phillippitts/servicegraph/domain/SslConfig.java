package com.phillippitts.servicegraph.domain;

/**
 * TLS settings of a service instance. Certificates are either issued through an ACME host or
 * supplied as a certificate/key file pair.
 *
 * @param enabled        whether TLS is on
 * @param certificate    certificate path, or null
 * @param certificateKey private key path, or null
 * @param acmeHost       ACME host used for automatic certificates, or null
 */
public record SslConfig(
        boolean enabled,
        String certificate,
        String certificateKey,
        String acmeHost
) {

    public static SslConfig disabled() {
        return new SslConfig(false, null, null, null);
    }

    public static SslConfig acme(String acmeHost) {
        return new SslConfig(true, null, null, acmeHost);
    }

    public static SslConfig files(String certificate, String certificateKey) {
        return new SslConfig(true, certificate, certificateKey, null);
    }

    public boolean usesAcme() {
        return isSet(acmeHost);
    }

    public boolean hasCertificateFiles() {
        return isSet(certificate) && isSet(certificateKey);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
