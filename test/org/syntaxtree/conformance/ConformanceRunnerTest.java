/*
 * Copyright 2026 The Syntax Tree Translation Authors.
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
package org.syntaxtree.conformance;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Files;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ConformanceRunnerTest {
  private static final String CORPUS =
      "!!! test_alias:1908\nalias foo bar\n!!! test_negative_power:1\n-2 ** 10\n";

  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String... args) {
    String[] withQuietLogging = new String[args.length + 1];
    System.arraycopy(args, 0, withQuietLogging, 0, args.length);
    withQuietLogging[args.length] = "--logging_level=OFF";
    return new ConformanceRunner(withQuietLogging, new PrintStream(out), new PrintStream(err))
        .run();
  }

  private File write(String name, String content) throws IOException {
    File file = folder.newFile(name);
    Files.asCharSink(file, UTF_8).write(content);
    return file;
  }

  @Test
  public void testHelp() {
    assertThat(run("--help")).isEqualTo(ConformanceRunner.EXIT_SUCCESS);
    assertThat(out.toString()).contains("--ruby_version");
  }

  @Test
  public void testUnknownFlag() {
    assertThat(run("--no_such_flag")).isEqualTo(ConformanceRunner.EXIT_BAD_FLAGS);
  }

  @Test
  public void testBadVersion() {
    assertThat(run("--ruby_version=banana")).isEqualTo(ConformanceRunner.EXIT_BAD_FLAGS);
    assertThat(err.toString()).startsWith("ERROR - ");
  }

  @Test
  public void testBadLoggingLevel() {
    String[] args = {"--filter=test_alias:*", "--logging_level=bogus"};
    int status = new ConformanceRunner(args, new PrintStream(out), new PrintStream(err)).run();
    assertThat(status).isEqualTo(ConformanceRunner.EXIT_BAD_FLAGS);
    assertThat(err.toString()).startsWith("ERROR - ");
  }

  @Test
  public void testFilteredBundledCorpus() {
    assertThat(run("--filter=test_alias:*", "--check_locations"))
        .isEqualTo(ConformanceRunner.EXIT_SUCCESS);
  }

  @Test
  public void testFailingCase() throws IOException {
    File corpus = write("corpus.txt", CORPUS);
    assertThat(run("--corpus=" + corpus.getPath())).isEqualTo(ConformanceRunner.EXIT_FAILURES);
  }

  @Test
  public void testSuppressionFile() throws IOException {
    File corpus = write("corpus.txt", CORPUS);
    File rules = write("rules.txt", "# sign folding\ntodo test_negative_power:* >= 2.7\n");
    assertThat(run("--corpus=" + corpus.getPath(), "--suppressions=" + rules.getPath()))
        .isEqualTo(ConformanceRunner.EXIT_SUCCESS);
  }

  @Test
  public void testJsonReport() throws IOException {
    File corpus = write("corpus.txt", CORPUS);
    File report = new File(folder.getRoot(), "report.json");
    run("--corpus=" + corpus.getPath(), "--json_report=" + report.getPath());

    JsonArray results = JsonParser.parseString(Files.asCharSource(report, UTF_8).read())
        .getAsJsonArray();
    assertThat(results.size()).isEqualTo(2);
    JsonObject pass = results.get(0).getAsJsonObject();
    assertThat(pass.get("label").getAsString()).isEqualTo("test_alias:1908");
    assertThat(pass.get("outcome").getAsString()).isEqualTo("PASS");
    assertThat(pass.has("rule")).isFalse();
    JsonObject fail = results.get(1).getAsJsonObject();
    assertThat(fail.get("outcome").getAsString()).isEqualTo("FAIL");
    assertThat(fail.get("path").getAsString()).startsWith("/send");
    assertThat(fail.get("message").getAsString()).contains("(int -2)");
  }

  @Test
  public void testPrintTree() {
    assertThat(run("--print_tree", "--filter=test_alias:1908"))
        .isEqualTo(ConformanceRunner.EXIT_SUCCESS);
    String tree = "(alias\n  (sym :foo)\n  (sym :bar))";
    assertThat(out.toString())
        .isEqualTo("# test_alias:1908\n" + tree + "\n" + tree + "\n");
  }

  @Test
  public void testPrintTreeReportsParseErrors() throws IOException {
    File corpus = write("corpus.txt", "!!! test_broken:1\nfoo(\n");
    assertThat(run("--print_tree", "--corpus=" + corpus.getPath()))
        .isEqualTo(ConformanceRunner.EXIT_SUCCESS);
    String printed = out.toString();
    assertThat(printed).startsWith("# test_broken:1\nreference parser: ");
    assertThat(printed).contains("\nprimary parser: ");
  }
}
