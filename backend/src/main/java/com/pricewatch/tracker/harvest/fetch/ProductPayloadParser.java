package com.pricewatch.tracker.harvest.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricewatch.tracker.harvest.model.PriceInfo;
import com.pricewatch.tracker.harvest.model.ProductSnapshot;
import com.pricewatch.tracker.harvest.model.PromotionInfo;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

class ProductPayloadParser {
    private final ObjectMapper objectMapper;

    ProductPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    ProductSnapshot parse(String identifier, String body) throws IOException {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonNode root = objectMapper.readTree(body);
        JsonNode element = root.isArray() ? root.path(0) : root;
        JsonNode product = element.path("data").path("product");
        if (!product.isObject()) {
            return null;
        }
        JsonNode price = product.path("price");
        if (!price.isObject() || decimal(price.path("actual")) == null) {
            return null;
        }

        String packSizeValue = null;
        String packSizeUnit = null;
        JsonNode packSize = product.path("details").path("packSize");
        if (packSize.isArray() && packSize.size() > 0) {
            packSize = packSize.get(0);
        }
        if (packSize.isObject()) {
            packSizeValue = text(packSize.path("value"));
            packSizeUnit = text(packSize.path("units"));
        }

        List<PromotionInfo> promotions = new ArrayList<>();
        for (JsonNode promotion : product.path("promotions")) {
            List<String> attributes = new ArrayList<>();
            for (JsonNode attribute : promotion.path("attributes")) {
                if (attribute.isTextual()) {
                    attributes.add(attribute.asText());
                }
            }
            promotions.add(new PromotionInfo(
                text(promotion.path("id")),
                text(promotion.path("description")),
                text(promotion.path("startDate")),
                text(promotion.path("endDate")),
                attributes,
                decimal(promotion.path("price").path("afterDiscount"))
            ));
        }

        return new ProductSnapshot(
            identifier,
            text(product.path("title")),
            text(product.path("defaultImageUrl")),
            packSizeValue,
            packSizeUnit,
            new PriceInfo(
                decimal(price.path("actual")),
                decimal(price.path("unitPrice")),
                text(price.path("unitOfMeasure"))
            ),
            promotions
        );
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
