package com.example.tradestore.config;

import com.example.tradestore.validation.FieldShape;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code trade-store} prefix.
 */
@Data
@ConfigurationProperties(prefix = "trade-store")
public class TradeStoreProperties {

    private Validation validation = new Validation();

    private OperationLog operationLog = new OperationLog();

    @Data
    public static class Validation {

        /**
         * Paths every trade must carry. Replaced as a whole when configured.
         */
        private List<RequiredField> requiredFields = new ArrayList<>(List.of(
                new RequiredField("general.tradeId", FieldShape.STRING, true),
                new RequiredField("general.transactionRoles.priceMaker", FieldShape.STRING, true),
                new RequiredField("common.book", FieldShape.STRING, false),
                new RequiredField("common.tradeDate", FieldShape.STRING, false),
                new RequiredField("common.counterparty", FieldShape.STRING, false),
                new RequiredField("common.inputDate", FieldShape.STRING, false)
        ));

        private List<String> dateFields = new ArrayList<>(List.of("common.tradeDate", "common.inputDate"));

        private String datePattern = "uuuu-MM-dd";

        /**
         * When false, a document of unknown trade type only draws a warning.
         */
        private boolean requireTradeType = true;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RequiredField {

        private String path;

        private FieldShape shape = FieldShape.SCALAR;

        private boolean allowBlank;
    }

    @Data
    public static class OperationLog {

        private int maxEntries = 10_000;
    }
}
