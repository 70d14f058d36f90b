package com.investidor.backend.valuation;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ValuationProperties.class)
public class ValuationConfiguration {}
