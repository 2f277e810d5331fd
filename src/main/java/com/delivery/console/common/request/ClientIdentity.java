package com.delivery.console.common.request;

import com.delivery.console.common.param.ParamValue;
import org.apache.commons.lang3.StringUtils;

/**
 * Account identifiers added to every request before signing.
 */
public record ClientIdentity(String clientId, String senderId) {
    public static final String CLIENT_ID = "client_id";
    public static final String SENDER_ID = "sender_id";

    public ClientIdentity {
        if (StringUtils.isBlank(clientId) || StringUtils.isBlank(senderId)) {
            throw new IllegalArgumentException("client_id and sender_id are required");
        }
    }

    ParamValue.Mapping asParams() {
        return ParamValue.mapping()
                .put(CLIENT_ID, clientId)
                .put(SENDER_ID, senderId)
                .build();
    }
}
