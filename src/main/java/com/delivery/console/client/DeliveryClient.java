package com.delivery.console.client;

import com.delivery.console.common.model.ConfigurationException;
import com.delivery.console.common.model.ParameterValidationException;
import com.delivery.console.common.param.ParamValue;
import com.delivery.console.common.request.DeliveryApi;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Endpoint wrappers over {@link DeliveryApi}. Method names follow the remote API, see
 * http://docs.yandexdelivery.apiary.io/.
 */
public class DeliveryClient {
    public static final String ORDER_REQUISITE = "order_requisite";
    public static final String ORDER_WAREHOUSE = "order_warehouse";

    private final DeliveryApi api;
    private final List<String> warehouseIds;
    private final List<String> requisiteIds;

    public DeliveryClient(DeliveryApi api, List<String> warehouseIds, List<String> requisiteIds) {
        this.api = api;
        this.warehouseIds = warehouseIds == null ? List.of() : List.copyOf(warehouseIds);
        this.requisiteIds = requisiteIds == null ? List.of() : List.copyOf(requisiteIds);
    }

    public JsonNode request(String method, ParamValue.Mapping params) {
        if (StringUtils.isBlank(method)) {
            throw new ParameterValidationException("Method name is required");
        }
        return api.request(method, params);
    }

    public JsonNode getSenderInfo() {
        return api.request("getSenderInfo", ParamValue.mapping().build());
    }

    public JsonNode getWarehouseInfo(String warehouseId) {
        return api.request("getWarehouseInfo", ParamValue.mapping().put("warehouse_id", warehouseId).build());
    }

    public JsonNode getRequisiteInfo(String requisiteId) {
        return api.request("getRequisiteInfo", ParamValue.mapping().put("requisite_id", requisiteId).build());
    }

    /**
     * Completes a city, street or house name.
     *
     * @param type {@code address} when {@code null}; {@code street} and {@code house} need a
     *             locality name or geo id, {@code house} also needs a street
     */
    public JsonNode autocomplete(String term, AutocompleteType type, String localityName, String geoId, String street) {
        AutocompleteType completeType = type == null ? AutocompleteType.ADDRESS : type;
        if (completeType.requiresLocality() && StringUtils.isAllBlank(geoId, localityName)) {
            throw new ParameterValidationException(
                    "Type '" + completeType.id() + "' requires geo_id or locality_name");
        }
        if (completeType == AutocompleteType.HOUSE && StringUtils.isBlank(street)) {
            throw new ParameterValidationException("Type '" + completeType.id() + "' requires street");
        }
        return api.request("autocomplete", ParamValue.mapping()
                .put("term", term)
                .put("type", completeType.id())
                .put("locality_name", localityName)
                .put("geo_id", geoId)
                .put("street", street)
                .build());
    }

    public JsonNode getIndex(String address) {
        return api.request("getIndex", ParamValue.mapping().put("address", address).build());
    }

    public JsonNode searchDeliveryList(DeliverySearch search) {
        if (search == null || StringUtils.isAnyBlank(search.cityFrom(), search.cityTo())
                || search.weight() == null || search.width() == null || search.height() == null || search.length() == null) {
            throw new ParameterValidationException(
                    "city_from, city_to, weight, width, height and length are required");
        }
        return api.request("searchDeliveryList", search.toParams());
    }

    /**
     * Creates an order. Null fields are dropped; {@code order_requisite} and
     * {@code order_warehouse} fall back to the first configured ids.
     *
     * @throws ConfigurationException when a fallback id is needed but none is configured
     */
    public JsonNode createOrder(ParamValue.Mapping order) {
        Map<String, ParamValue> data = new LinkedHashMap<>();
        if (order != null) {
            order.entries().forEach((key, value) -> {
                if (!isNone(value)) {
                    data.put(key, value);
                }
            });
        }
        if (!data.containsKey(ORDER_REQUISITE)) {
            data.put(ORDER_REQUISITE, ParamValue.of(first(requisiteIds, "requisite")));
        }
        if (!data.containsKey(ORDER_WAREHOUSE)) {
            data.put(ORDER_WAREHOUSE, ParamValue.of(first(warehouseIds, "warehouse")));
        }
        return api.request("createOrder", new ParamValue.Mapping(data));
    }

    private static boolean isNone(ParamValue value) {
        return value instanceof ParamValue.Scalar scalar && scalar.value() == null;
    }

    private static String first(List<String> ids, String kind) {
        if (ids.isEmpty()) {
            throw new ConfigurationException("No default " + kind + " id configured for createOrder");
        }
        return ids.get(0);
    }
}
