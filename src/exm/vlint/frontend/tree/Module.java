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
package exm.vlint.frontend.tree;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.vlint.ast.VlogAST;
import exm.vlint.ast.antlr.VLintParser;
import exm.vlint.common.exceptions.VLintRuntimeError;
import exm.vlint.frontend.LogHelper;

/**
 * Typed model of one Verilog module.  Header parameters come first in
 * the parameter list, followed by parameter and localparam declarations
 * from the body in source order.
 */
public final class Module {

  private final String name;
  private final ImmutableList<Parameter> parameters;
  private final ImmutableList<Port> ports;
  private final ImmutableList<ModuleItem> items;

  public Module(String name, List<Parameter> parameters, List<Port> ports,
                List<ModuleItem> items) {
    this.name = Preconditions.checkNotNull(name);
    this.parameters = ImmutableList.copyOf(parameters);
    this.ports = ImmutableList.copyOf(ports);
    this.items = ImmutableList.copyOf(items);
  }

  public String getName() {
    return name;
  }

  public List<Parameter> getParameters() {
    return parameters;
  }

  public List<Port> getPorts() {
    return ports;
  }

  public List<ModuleItem> getItems() {
    return items;
  }

  public static Module fromAST(VlogAST tree) {
    if (tree.getType() != VLintParser.MODULE_DEF || tree.childCount() != 4) {
      throw new VLintRuntimeError("Expected module definition, got " +
                                  LogHelper.tokName(tree.getType()));
    }
    String name = tree.child(0).getText();
    LogHelper.debug(0, "Building module " + name);

    ImmutableList.Builder<Parameter> params = ImmutableList.builder();
    for (VlogAST paramT: tree.child(1).children()) {
      params.add(Parameter.fromAST(paramT));
    }

    ImmutableList.Builder<Port> ports = ImmutableList.builder();
    for (VlogAST portT: tree.child(2).children()) {
      ports.addAll(Port.fromAST(portT));
    }

    ImmutableList.Builder<ModuleItem> items = ImmutableList.builder();
    for (VlogAST itemT: tree.child(3).children()) {
      switch (itemT.getType()) {
        case VLintParser.PARAM_DEF:
          params.add(Parameter.fromAST(itemT));
          break;
        case VLintParser.SIGNAL_DECL:
          items.add(SignalDeclaration.fromAST(itemT));
          break;
        case VLintParser.CONTINUOUS_ASSIGNMENT:
          items.add(ContinuousAssignment.fromAST(itemT));
          break;
        case VLintParser.ALWAYS_BLOCK:
          items.add(AlwaysBlock.fromAST(itemT));
          break;
        default:
          throw new VLintRuntimeError("Unexpected module item: " +
                                      LogHelper.tokName(itemT.getType()));
      }
    }
    return new Module(name, params.build(), ports.build(), items.build());
  }
}
