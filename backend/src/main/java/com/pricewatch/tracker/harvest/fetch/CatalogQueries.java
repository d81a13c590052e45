package com.pricewatch.tracker.harvest.fetch;

import com.pricewatch.tracker.harvest.model.FetchMode;

final class CatalogQueries {
    static final String FULL_PRODUCT_QUERY = """
        query GetProduct($tpnc: String) {
          product(tpnc: $tpnc) {
            id
            title
            defaultImageUrl
            productType
            details {
              packSize {
                value
                units
              }
            }
            price {
              actual
              unitPrice
              unitOfMeasure
            }
            promotions {
              id
              startDate
              endDate
              description
              attributes
              price {
                afterDiscount
              }
            }
          }
        }
        """;

    static final String PRICE_ONLY_QUERY = """
        query GetProductPrice($tpnc: String) {
          product(tpnc: $tpnc) {
            id
            price {
              actual
              unitPrice
              unitOfMeasure
            }
            promotions {
              id
              startDate
              endDate
              description
              attributes
              price {
                afterDiscount
              }
            }
          }
        }
        """;

    private CatalogQueries() {
    }

    static String queryFor(FetchMode mode) {
        return mode == FetchMode.FULL ? FULL_PRODUCT_QUERY : PRICE_ONLY_QUERY;
    }
}
