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
package exm.minic.frontend.tree;

import exm.minic.ast.AstNode;
import exm.minic.ast.BasicType;
import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.frontend.cst.ParseNode;

public class TypeTree {

  public static BasicType resolve(ParseNode typeTok) {
    switch (typeTok.tokenKind()) {
      case INT:
        return BasicType.INT;
      default:
        throw new MiniCRuntimeError("Not a type: " + typeTok);
    }
  }

  /**
   * @return new type leaf, on the line of the type keyword
   */
  public static AstNode typeLeaf(ParseNode typeTok) {
    return AstNode.newType(resolve(typeTok), typeTok.line());
  }
}
