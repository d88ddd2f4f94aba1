package com.chaincustody.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Per (chain, currency) withdrawal settings: amount precision and service fee (percentage with a floor).
 */
@Document(collection = "tokens")
@CompoundIndex(name = "chain_currency", def = "{'chain': 1, 'currency': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TokenSettings {

    static final int DEFAULT_PRECISION = 8;

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String chain;
    private String currency;
    private Integer decimals;
    private Integer precision;
    /** Service fee in percent of the amount, e.g. 0.5 for 0.5%. */
    private BigDecimal feePercentage;
    /** Minimum service fee in standard units. */
    private BigDecimal feeMinimum;

    /** Precision, falling back to decimals, then 8. */
    public int effectivePrecision() {
        if (precision != null) {
            return precision;
        }
        return decimals != null ? decimals : DEFAULT_PRECISION;
    }
}
