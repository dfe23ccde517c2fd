package com.fxplatform.common.registry;

@FunctionalInterface
public interface RegistryChangeListener {
    void onChange(RegistryChangeEvent event);
}
