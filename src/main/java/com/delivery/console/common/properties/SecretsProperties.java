package com.delivery.console.common.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Account settings from the service's Integration / API page.
 */
@ConfigurationProperties(prefix = "secrets")
@Validated
public class SecretsProperties {
    @NotBlank
    private String clientId;
    @NotBlank
    private String senderId;
    private List<String> warehouseIds = new ArrayList<>();
    private List<String> requisiteIds = new ArrayList<>();
    private Map<String, String> methodKeys = new LinkedHashMap<>();

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getSenderId() {
        return senderId;
    }

    public void setSenderId(String senderId) {
        this.senderId = senderId;
    }

    public List<String> getWarehouseIds() {
        return warehouseIds;
    }

    public void setWarehouseIds(List<String> warehouseIds) {
        this.warehouseIds = warehouseIds;
    }

    public List<String> getRequisiteIds() {
        return requisiteIds;
    }

    public void setRequisiteIds(List<String> requisiteIds) {
        this.requisiteIds = requisiteIds;
    }

    public Map<String, String> getMethodKeys() {
        return methodKeys;
    }

    public void setMethodKeys(Map<String, String> methodKeys) {
        this.methodKeys = methodKeys;
    }
}
