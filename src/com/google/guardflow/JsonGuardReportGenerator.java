/*
 * Copyright 2026 The Guardflow Authors.
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

package com.google.guardflow;

import com.google.common.base.Ascii;
import com.google.gson.stream.JsonWriter;
import com.google.guardflow.cfg.BasicBlock;
import com.google.guardflow.ir.SyntaxNode;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringWriter;

/** Prints the result of a guard query to a print stream as a JSON object. */
public class JsonGuardReportGenerator {
  private final PrintStream stream;

  /**
   * @param stream the stream on which the report is printed. This class does not close the
   *     stream
   */
  public JsonGuardReportGenerator(PrintStream stream) {
    this.stream = stream;
  }

  /**
   * Prints the guard found for {@code target}, and whether it proves that the test for {@code
   * platform} succeeded.
   */
  public void generateReport(
      SyntaxNode target, BasicBlock block, PlatformCheck guard, String platform) {
    StringWriter buffer = new StringWriter();
    try (JsonWriter jsonWriter = new JsonWriter(buffer)) {
      jsonWriter.beginObject();
      jsonWriter.name("target").value(target.getText());
      jsonWriter.name("block").value(block.getOrdinal());

      jsonWriter.name("guard").beginObject();
      jsonWriter.name("kind").value(Ascii.toLowerCase(guard.getKind().name()));
      if (guard.isLeaf()) {
        jsonWriter.name("platform").value(guard.getPlatform());
        jsonWriter.name("negated").value(guard.isNegated());
      }
      jsonWriter.endObject();

      jsonWriter.name("guaranteed").value(guard.isGuaranteed(platform, false));
      jsonWriter.endObject();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    stream.println(buffer);
  }
}
