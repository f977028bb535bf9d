/*
 * Copyright 2024 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.seismicqc.statistics;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Resolves reducers by name or alias. The lookup table is static and built
 * once; names are matched case-insensitively.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class ReducerFactory {

    /**
     * Get a reducer by name.
     *
     * @param name The name or alias of the desired reducer.
     * @return The {@link Reducer}.
     */
    public Reducer getReducer(final String name) {
        final Optional<Reducer> reducer = tryGetReducer(name);
        if (!reducer.isPresent()) {
            throw new IllegalArgumentException(String.format("Invalid reducer name; name=%s", name));
        }
        return reducer.get();
    }

    /**
     * Get a reducer by name.
     *
     * @param name The name or alias of the desired reducer.
     * @return The {@link Reducer} if one is registered under the name.
     */
    public Optional<Reducer> tryGetReducer(final String name) {
        return Optional.ofNullable(REDUCERS_BY_NAME_AND_ALIAS.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Wrap a caller supplied function as a {@link Reducer}.
     *
     * @param name The name reported for the reducer.
     * @param function The reduction function.
     * @return A new {@link CustomReducer}.
     */
    public Reducer createCustomReducer(final String name, final ToDoubleFunction<double[]> function) {
        return new CustomReducer(name, function);
    }

    /**
     * The canonical names of all registered reducers.
     *
     * @return The reducer names.
     */
    public ImmutableList<String> getReducerNames() {
        return REDUCERS.stream().map(Reducer::getName).collect(ImmutableList.toImmutableList());
    }

    private static void checkedPut(final Map<String, Reducer> map, final Reducer reducer, final String key) {
        final Reducer existingReducer = map.putIfAbsent(key, reducer);
        if (existingReducer != null && !existingReducer.equals(reducer)) {
            throw new IllegalStateException(String.format(
                    "Reducer already registered; key=%s, existing=%s, new=%s",
                    key,
                    existingReducer,
                    reducer));
        }
    }

    private static final ImmutableList<Reducer> REDUCERS = ImmutableList.of(
            new MeanReducer(),
            new MinReducer(),
            new MaxReducer(),
            new MedianReducer(),
            new StdReducer(),
            new RmsReducer(),
            new AbsMeanReducer(),
            new SumReducer(),
            new CountReducer());
    private static final ImmutableMap<String, Reducer> REDUCERS_BY_NAME_AND_ALIAS;

    static {
        final Map<String, Reducer> reducerByNameAndAlias = Maps.newLinkedHashMap();
        for (final Reducer reducer : REDUCERS) {
            checkedPut(reducerByNameAndAlias, reducer, reducer.getName());
            for (final String alias : reducer.getAliases()) {
                checkedPut(reducerByNameAndAlias, reducer, alias);
            }
        }
        REDUCERS_BY_NAME_AND_ALIAS = ImmutableMap.copyOf(reducerByNameAndAlias);
    }
}
