/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.minic.frontend;

import exm.minic.antlr.AntlrFrontEnd;
import exm.minic.common.Settings;
import exm.minic.common.exceptions.InvalidOptionException;
import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.parser.HandWrittenFrontEnd;

/**
 * The available front ends
 */
public enum FrontEndKind {
  /** Generated lexer and parser */
  ANTLR(Settings.FRONTEND_ANTLR),
  /** Hand-written scanner and recursive descent parser */
  HANDWRITTEN(Settings.FRONTEND_HANDWRITTEN);

  private final String settingName;

  private FrontEndKind(String settingName) {
    this.settingName = settingName;
  }

  public String settingName() {
    return settingName;
  }

  public FrontEnd create() {
    switch (this) {
      case ANTLR:
        return new AntlrFrontEnd();
      case HANDWRITTEN:
        return new HandWrittenFrontEnd();
      default:
        throw new MiniCRuntimeError("Unknown front end " + this);
    }
  }

  /**
   * @param name name as used in settings, case insensitive
   */
  public static FrontEndKind fromName(String name)
      throws InvalidOptionException {
    for (FrontEndKind kind: values()) {
      if (kind.settingName.equalsIgnoreCase(name)) {
        return kind;
      }
    }
    throw new InvalidOptionException("Unknown front end: " + name);
  }

  /**
   * @return front end selected in {@link Settings}
   */
  public static FrontEndKind fromSettings() throws InvalidOptionException {
    return fromName(Settings.get(Settings.FRONTEND));
  }
}
