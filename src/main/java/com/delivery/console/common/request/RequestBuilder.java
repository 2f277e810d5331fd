package com.delivery.console.common.request;

import com.delivery.console.common.encoding.QueryEncoder;
import com.delivery.console.common.model.ConfigurationException;
import com.delivery.console.common.param.ParamValue;
import com.delivery.console.common.signing.SignatureComputer;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.util.Map;

/**
 * Turns a method name and its parameters into a signed form POST. Performs no I/O.
 */
public class RequestBuilder {
    public static final String SECRET_KEY = "secret_key";
    public static final String DEFAULT_USER_AGENT = "DeliveryConsole/Java";

    private final String baseUrl;
    private final String version;
    private final String userAgent;
    private final ClientIdentity identity;
    private final MethodSecretRegistry secrets;
    private final SignatureComputer signatureComputer;
    private final QueryEncoder encoder;

    public RequestBuilder(String baseUrl, String version, String userAgent, ClientIdentity identity,
                          MethodSecretRegistry secrets, SignatureComputer signatureComputer, QueryEncoder encoder) {
        if (StringUtils.isBlank(baseUrl) || StringUtils.isBlank(version)) {
            throw new IllegalArgumentException("API base url and version are required");
        }
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
        this.version = version;
        this.userAgent = StringUtils.defaultIfBlank(userAgent, DEFAULT_USER_AGENT);
        this.identity = identity;
        this.secrets = secrets;
        this.signatureComputer = signatureComputer;
        this.encoder = encoder;
    }

    /**
     * @throws ConfigurationException when {@code method} has no method key
     */
    public SignedRequest build(String method, ParamValue.Mapping params) {
        String secret = secrets.require(method);
        ParamValue.Mapping data = (params == null ? ParamValue.mapping().build() : params).merge(identity.asParams());
        String signature = signatureComputer.sign(data, secret);
        ParamValue.Mapping signed = data.with(SECRET_KEY, ParamValue.of(signature)).withoutEmpty();
        String body = encoder.encode(signed);
        return new SignedRequest(method, url(method), body, headers(), signature);
    }

    public String url(String method) {
        return String.join("/", baseUrl, version, method);
    }

    private Map<String, String> headers() {
        return Map.of(
                HttpHeaders.USER_AGENT, userAgent,
                HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_FORM_URLENCODED_VALUE
        );
    }
}
