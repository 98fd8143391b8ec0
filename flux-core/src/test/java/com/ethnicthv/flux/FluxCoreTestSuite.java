package com.ethnicthv.flux;

import com.ethnicthv.flux.core.SubscriptionTest;
import com.ethnicthv.flux.core.convert.ConverterRegistryTest;
import com.ethnicthv.flux.core.events.EventBusTest;
import com.ethnicthv.flux.core.events.EventBusThreadSafetyTest;
import com.ethnicthv.flux.core.properties.ComputedPropertyTest;
import com.ethnicthv.flux.core.properties.PropertyStoreTest;
import com.ethnicthv.flux.core.properties.PropertyStoreThreadSafetyTest;
import com.ethnicthv.flux.core.properties.ReactiveCollectionTest;
import com.ethnicthv.flux.core.properties.ReactiveDictionaryTest;
import com.ethnicthv.flux.core.properties.ReactiveOperatorsTest;
import com.ethnicthv.flux.core.properties.ReactivePropertyTest;
import com.ethnicthv.flux.core.system.SystemManagerTest;
import com.ethnicthv.flux.core.threading.MainThreadMarshallerTest;
import org.junit.platform.suite.api.SelectClasses;
import org.junit.platform.suite.api.Suite;
import org.junit.platform.suite.api.SuiteDisplayName;

/**
 * Aggregate suite of the core tests, for running them together from an IDE.
 * <p>
 * Categories:
 * - Core functionality: cells, store, bus, converters, systems
 * - Thread safety: concurrent registration, subscription and writes
 */
@Suite
@SuiteDisplayName("Flux Core Test Suite")
@SelectClasses({
        // Core Functionality Tests
        SubscriptionTest.class,
        MainThreadMarshallerTest.class,
        EventBusTest.class,
        ReactivePropertyTest.class,
        ComputedPropertyTest.class,
        ReactiveOperatorsTest.class,
        ReactiveCollectionTest.class,
        ReactiveDictionaryTest.class,
        PropertyStoreTest.class,
        ConverterRegistryTest.class,
        SystemManagerTest.class,
        FluxTest.class,

        // QA/QC Thread Safety
        EventBusThreadSafetyTest.class,
        PropertyStoreThreadSafetyTest.class
})
public class FluxCoreTestSuite {
}
