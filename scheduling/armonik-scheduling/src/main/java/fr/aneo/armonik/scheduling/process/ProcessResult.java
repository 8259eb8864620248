/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
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
package fr.aneo.armonik.scheduling.process;

/**
 * Outcome of an external process waited on by {@link SubprocessWaiter}.
 *
 * @param exitCode the process exit code
 * @param stdout   everything the process wrote to its standard output
 * @param stderr   everything the process wrote to its standard error
 */
public record ProcessResult(int exitCode, String stdout, String stderr) {

  public boolean isSuccess() {
    return exitCode == 0;
  }
}
