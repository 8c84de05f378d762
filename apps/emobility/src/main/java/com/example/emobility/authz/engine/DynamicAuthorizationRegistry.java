package com.example.emobility.authz.engine;

import com.example.emobility.authz.assertion.DynamicAssert;
import com.example.emobility.authz.assertion.DynamicAssertName;
import com.example.emobility.authz.datasource.DataSourceName;
import com.example.emobility.authz.datasource.DynamicDataSource;
import com.example.emobility.authz.filter.DynamicFilter;
import com.example.emobility.authz.filter.DynamicFilterName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Name to implementation lookup for data sources, filters and asserts.
 * Startup fails when a name has no implementation or when a filter or assert needs a missing data source.
 */
@Slf4j
@Component
public class DynamicAuthorizationRegistry {

    private final Map<DataSourceName, DynamicDataSource> dataSources;
    private final Map<DynamicFilterName, DynamicFilter> filters;
    private final Map<DynamicAssertName, DynamicAssert> asserts;

    public DynamicAuthorizationRegistry(
            List<DynamicDataSource> dataSources,
            List<DynamicFilter> filters,
            List<DynamicAssert> asserts) {
        this.dataSources = index(DataSourceName.class, dataSources, DynamicDataSource::getName);
        this.filters = index(DynamicFilterName.class, filters, DynamicFilter::getName);
        this.asserts = index(DynamicAssertName.class, asserts, DynamicAssert::getName);

        filters.forEach(f -> f.getDataSourceName().ifPresent(this::dataSource));
        asserts.forEach(a -> a.getDataSourceName().ifPresent(this::dataSource));

        log.info("Dynamic authorization registry initialized: {} data sources, {} filters, {} asserts",
                this.dataSources.size(), this.filters.size(), this.asserts.size());
    }

    public DynamicDataSource dataSource(DataSourceName name) {
        return require(dataSources, name, "data source");
    }

    public DynamicFilter filter(DynamicFilterName name) {
        return require(filters, name, "filter");
    }

    public DynamicAssert assertion(DynamicAssertName name) {
        return require(asserts, name, "assert");
    }

    private static <K extends Enum<K>, V> Map<K, V> index(Class<K> keyType, List<V> values, Function<V, K> nameOf) {
        Map<K, V> map = new EnumMap<>(keyType);
        for (V value : values) {
            if (map.put(nameOf.apply(value), value) != null) {
                throw new IllegalStateException("Duplicate implementation for " + nameOf.apply(value));
            }
        }
        for (K key : keyType.getEnumConstants()) {
            if (!map.containsKey(key)) {
                throw new IllegalStateException("No implementation registered for " + key);
            }
        }
        return map;
    }

    private static <K, V> V require(Map<K, V> map, K name, String kind) {
        V value = map.get(name);
        if (value == null) {
            throw new IllegalStateException("Unknown " + kind + " " + name);
        }
        return value;
    }
}
