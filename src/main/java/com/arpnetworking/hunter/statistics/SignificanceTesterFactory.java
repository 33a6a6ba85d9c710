/*
 * Copyright 2026 Inscope Metrics
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
package com.arpnetworking.hunter.statistics;

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;

/**
 * Looks up significance testers by name or alias. Names are case
 * insensitive.
 *
 * @author Inscope Metrics
 */
public class SignificanceTesterFactory {

    /**
     * Get a tester by name.
     *
     * @param name The name of the desired tester.
     * @return The <code>SignificanceTester</code>.
     */
    public SignificanceTester getTester(final String name) {
        final Optional<SignificanceTester> tester = tryGetTester(name);
        if (!tester.isPresent()) {
            throw new IllegalArgumentException(String.format("Invalid significance tester name; name=%s", name));
        }
        return tester.get();
    }

    /**
     * Get a tester by name.
     *
     * @param name The name of the desired tester.
     * @return The <code>SignificanceTester</code> if one is registered under the name.
     */
    public Optional<SignificanceTester> tryGetTester(final String name) {
        return Optional.ofNullable(TESTERS_BY_NAME_AND_ALIAS.get(normalize(name)));
    }

    /**
     * The names of all registered testers, excluding aliases.
     *
     * @return The tester names.
     */
    public ImmutableSet<String> getTesterNames() {
        return TESTERS.stream()
                .map(SignificanceTester::getName)
                .collect(ImmutableSet.toImmutableSet());
    }

    private static String normalize(final String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static void checkedPut(final ConcurrentMap<String, SignificanceTester> map, final SignificanceTester tester) {
        checkedPut(map, tester, tester.getName());
        for (final String alias : tester.getAliases()) {
            checkedPut(map, tester, alias);
        }
    }

    private static void checkedPut(
            final ConcurrentMap<String, SignificanceTester> map,
            final SignificanceTester tester,
            final String key) {
        final SignificanceTester existingTester = map.putIfAbsent(normalize(key), tester);
        if (existingTester != null && !existingTester.equals(tester)) {
            LOGGER.error()
                    .setMessage("Significance tester already registered")
                    .addData("key", key)
                    .addData("existing", existingTester)
                    .addData("new", tester)
                    .log();
        }
    }

    private static final ImmutableList<SignificanceTester> TESTERS = ImmutableList.of(
            new TTestSignificanceTester(),
            new MannWhitneySignificanceTester());
    private static final ConcurrentMap<String, SignificanceTester> TESTERS_BY_NAME_AND_ALIAS;
    private static final Logger LOGGER = LoggerFactory.getLogger(SignificanceTesterFactory.class);

    static {
        final ConcurrentMap<String, SignificanceTester> testersByNameAndAlias = Maps.newConcurrentMap();
        for (final SignificanceTester tester : TESTERS) {
            checkedPut(testersByNameAndAlias, tester);
        }
        TESTERS_BY_NAME_AND_ALIAS = testersByNameAndAlias;
    }
}
