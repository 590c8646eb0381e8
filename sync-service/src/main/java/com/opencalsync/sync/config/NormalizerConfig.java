package com.opencalsync.sync.config;

import com.opencalsync.sync.normalize.CategoryRuleTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NormalizerConfig {

    @Bean
    public CategoryRuleTable categoryRuleTable() {
        return CategoryRuleTable.defaults();
    }
}
