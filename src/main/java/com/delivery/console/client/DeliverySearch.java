package com.delivery.console.client;

import com.delivery.console.common.param.ParamValue;

import java.math.BigDecimal;

/**
 * Arguments of {@code searchDeliveryList}. The first six are required by the API; the rest may be
 * {@code null}. Weight is in kilograms, dimensions in centimetres, money in roubles.
 *
 * @param geoIdTo       takes priority over {@code cityTo} when both are set
 * @param geoIdFrom     takes priority over {@code cityFrom} when both are set
 * @param deliveryType  courier or pickup; all variants when {@code null}
 * @param toYdWarehouse shipment directly to the carrier or through the shared warehouse
 */
public record DeliverySearch(
        String cityFrom,
        String cityTo,
        BigDecimal weight,
        Integer width,
        Integer height,
        Integer length,
        String geoIdTo,
        String geoIdFrom,
        String deliveryType,
        BigDecimal totalCost,
        Integer indexCity,
        Integer toYdWarehouse,
        BigDecimal orderCost,
        BigDecimal assessedValue
) {

    public static DeliverySearch of(String cityFrom, String cityTo, BigDecimal weight, int width, int height, int length) {
        return new DeliverySearch(cityFrom, cityTo, weight, width, height, length,
                null, null, null, null, null, null, null, null);
    }

    ParamValue.Mapping toParams() {
        return ParamValue.mapping()
                .putObject("city_from", cityFrom)
                .putObject("city_to", cityTo)
                .putObject("weight", weight)
                .putObject("width", width)
                .putObject("height", height)
                .putObject("length", length)
                .putObject("geo_id_to", geoIdTo)
                .putObject("geo_id_from", geoIdFrom)
                .putObject("delivery_type", deliveryType)
                .putObject("total_cost", totalCost)
                .putObject("index_city", indexCity)
                .putObject("to_yd_warehouse", toYdWarehouse)
                .putObject("order_cost", orderCost)
                .putObject("assessed_value", assessedValue)
                .build();
    }
}
