package com.investidor.backend.provider;

@FunctionalInterface
public interface ProviderSessionFactory {

    ProviderSession create();
}
