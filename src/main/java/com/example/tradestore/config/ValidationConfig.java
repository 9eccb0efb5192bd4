package com.example.tradestore.config;

import com.example.tradestore.validation.BusinessRuleValidator;
import com.example.tradestore.validation.CommodityOptionValidator;
import com.example.tradestore.validation.IndexSwapValidator;
import com.example.tradestore.validation.IrSwapValidator;
import com.example.tradestore.validation.StructuralValidator;
import com.example.tradestore.validation.TradeTypeDetector;
import com.example.tradestore.validation.ValidatorChain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Assembles the validator chain from {@link TradeStoreProperties}.
 */
@Slf4j
@Configuration
public class ValidationConfig {

    @Bean
    public ValidatorChain validatorChain(TradeStoreProperties properties, TradeTypeDetector tradeTypeDetector) {
        TradeStoreProperties.Validation validation = properties.getValidation();
        log.info("Validator chain: {} required field(s), date fields {}, require trade type: {}",
                validation.getRequiredFields().size(), validation.getDateFields(), validation.isRequireTradeType());

        // structural before business rules
        return new ValidatorChain(
                List.of(
                        new StructuralValidator(validation.getRequiredFields()),
                        new BusinessRuleValidator(validation.getDateFields(), validation.getDatePattern())
                ),
                List.of(new IrSwapValidator(), new CommodityOptionValidator(), new IndexSwapValidator()),
                tradeTypeDetector,
                validation.isRequireTradeType()
        );
    }
}
