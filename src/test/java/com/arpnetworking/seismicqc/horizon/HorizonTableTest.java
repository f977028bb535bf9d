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
package com.arpnetworking.seismicqc.horizon;

import com.arpnetworking.seismicqc.models.HorizonEntry;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;

/**
 * Tests for the {@link HorizonTable} class.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class HorizonTableTest {

    @Test
    public void testParse() {
        final HorizonTable table = HorizonTable.parse(
                "INLINE: 100 XLINE: 200 1520.5\n"
                        + "\n"
                        + "   \n"
                        + "101\t200   3.0 4.0   1530.0\n");
        Assert.assertEquals(2, table.size());
        Assert.assertEquals(Optional.of(1520.5), table.lookup(100, 200));
        Assert.assertEquals(1530.0, table.require(101, 200), 0.0);
        Assert.assertEquals(new HorizonEntry(100, 200, 1520.5), table.getEntries().get(0));
    }

    @Test
    public void testFirstDuplicateWins() {
        final HorizonTable table = HorizonTable.parse("1 2 10.0\n1 2 20.0\n");
        Assert.assertEquals(1, table.size());
        Assert.assertEquals(10.0, table.require(1, 2), 0.0);
    }

    @Test
    public void testLookupMiss() {
        final HorizonTable table = HorizonTable.parse("1 2 10.0\n");
        Assert.assertFalse(table.lookup(2, 1).isPresent());
        try {
            table.require(2, 1);
            Assert.fail("Expected exception not thrown");
        } catch (final HorizonLookupException e) {
            Assert.assertEquals(2, e.getInline());
            Assert.assertEquals(1, e.getCrossline());
        }
    }

    @Test
    public void testTooFewColumns() {
        try {
            HorizonTable.parse("1 2 10.0\nINLINE 3 XLINE 4\n");
            Assert.fail("Expected exception not thrown");
        } catch (final HorizonParseException e) {
            Assert.assertEquals(2, e.getLineNumber());
        }
    }

    @Test
    public void testMalformedNumber() {
        try {
            HorizonTable.parse("1.5 2 10.0\n");
            Assert.fail("Expected exception not thrown");
        } catch (final HorizonParseException e) {
            Assert.assertEquals(1, e.getLineNumber());
            Assert.assertTrue(e.getCause() instanceof NumberFormatException);
        }
    }

    @Test
    public void testEmpty() {
        Assert.assertEquals(0, HorizonTable.parse("").size());
    }

    @Test
    public void testLoad() throws IOException {
        final File file = _temporaryFolder.newFile("horizon.txt");
        Files.write(file.toPath(), "7 8 99.5\n".getBytes(StandardCharsets.UTF_8));
        Assert.assertEquals(99.5, HorizonTable.load(file.toPath()).require(7, 8), 0.0);
    }

    @Rule
    public TemporaryFolder _temporaryFolder = new TemporaryFolder();
}
