package com.ethnicthv.flux.core.convert;

/**
 * Service interface implemented by the generated converter indices and discovered through
 * {@link java.util.ServiceLoader}.
 */
public interface ConverterIndex {

    void registerAll(ConverterRegistry registry);
}
