/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.unparse.ast;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Visits syntax trees.
 *
 * <p>The default implementation of each method visits the node's children
 * in the order they are declared, and does nothing else. A sub-class that
 * overrides some methods therefore still reaches every node beneath the
 * kinds it does not handle.
 */
public class Visitor {

  /** Visits a node, if it is not null. All traversal goes through this
   * method, so sub-classes can intercept it. */
  protected void accept(@Nullable PyNode node) {
    if (node != null) {
      node.accept(this);
    }
  }

  /** Visits each node in a list, skipping nulls. */
  protected void acceptAll(List<? extends @Nullable PyNode> nodes) {
    nodes.forEach(this::accept);
  }

  // roots

  protected void visit(Py.Module module) {
    acceptAll(module.body);
  }

  protected void visit(Py.Interactive interactive) {
    acceptAll(interactive.body);
  }

  protected void visit(Py.Expression expression) {
    accept(expression.body);
  }

  // statements

  protected void visit(Py.FunctionDef functionDef) {
    acceptAll(functionDef.decoratorList);
    accept(functionDef.args);
    accept(functionDef.returns);
    acceptAll(functionDef.body);
  }

  protected void visit(Py.ClassDef classDef) {
    acceptAll(classDef.decoratorList);
    acceptAll(classDef.bases);
    acceptAll(classDef.keywords);
    acceptAll(classDef.body);
  }

  protected void visit(Py.Return aReturn) {
    accept(aReturn.value);
  }

  protected void visit(Py.Delete delete) {
    acceptAll(delete.targets);
  }

  protected void visit(Py.Assign assign) {
    acceptAll(assign.targets);
    accept(assign.value);
  }

  protected void visit(Py.AugAssign augAssign) {
    accept(augAssign.target);
    accept(augAssign.value);
  }

  protected void visit(Py.AnnAssign annAssign) {
    accept(annAssign.target);
    accept(annAssign.annotation);
    accept(annAssign.value);
  }

  protected void visit(Py.For aFor) {
    accept(aFor.target);
    accept(aFor.iter);
    acceptAll(aFor.body);
    acceptAll(aFor.orelse);
  }

  protected void visit(Py.While aWhile) {
    accept(aWhile.test);
    acceptAll(aWhile.body);
    acceptAll(aWhile.orelse);
  }

  protected void visit(Py.If anIf) {
    accept(anIf.test);
    acceptAll(anIf.body);
    acceptAll(anIf.orelse);
  }

  protected void visit(Py.With with) {
    acceptAll(with.items);
    acceptAll(with.body);
  }

  protected void visit(Py.Raise raise) {
    accept(raise.exc);
    accept(raise.cause);
  }

  protected void visit(Py.Try aTry) {
    acceptAll(aTry.body);
    acceptAll(aTry.handlers);
    acceptAll(aTry.orelse);
    acceptAll(aTry.finalbody);
  }

  protected void visit(Py.Assert anAssert) {
    accept(anAssert.test);
    accept(anAssert.msg);
  }

  protected void visit(Py.Import anImport) {
    acceptAll(anImport.names);
  }

  protected void visit(Py.ImportFrom importFrom) {
    acceptAll(importFrom.names);
  }

  protected void visit(Py.Global global) {}

  protected void visit(Py.Expr expr) {
    accept(expr.value);
  }

  protected void visit(Py.Keyword0 keyword0) {}

  // expressions

  protected void visit(Py.BoolOp boolOp) {
    acceptAll(boolOp.values);
  }

  protected void visit(Py.NamedExpr namedExpr) {
    accept(namedExpr.target);
    accept(namedExpr.value);
  }

  protected void visit(Py.BinOp binOp) {
    accept(binOp.left);
    accept(binOp.right);
  }

  protected void visit(Py.UnaryOp unaryOp) {
    accept(unaryOp.operand);
  }

  protected void visit(Py.Lambda lambda) {
    accept(lambda.args);
    accept(lambda.body);
  }

  protected void visit(Py.IfExp ifExp) {
    accept(ifExp.test);
    accept(ifExp.body);
    accept(ifExp.orelse);
  }

  protected void visit(Py.Dict dict) {
    for (int i = 0; i < dict.values.size(); i++) {
      accept(dict.keys.get(i));
      accept(dict.values.get(i));
    }
  }

  protected void visit(Py.Set set) {
    acceptAll(set.elts);
  }

  protected void visit(Py.Comp comp) {
    accept(comp.elt);
    acceptAll(comp.generators);
  }

  protected void visit(Py.DictComp dictComp) {
    accept(dictComp.key);
    accept(dictComp.value);
    acceptAll(dictComp.generators);
  }

  protected void visit(Py.Await await) {
    accept(await.value);
  }

  protected void visit(Py.Compare compare) {
    accept(compare.left);
    acceptAll(compare.comparators);
  }

  protected void visit(Py.Call call) {
    accept(call.func);
    acceptAll(call.args);
    acceptAll(call.keywords);
  }

  protected void visit(Py.FormattedValue formattedValue) {
    accept(formattedValue.value);
    accept(formattedValue.formatSpec);
  }

  protected void visit(Py.JoinedStr joinedStr) {
    acceptAll(joinedStr.values);
  }

  protected void visit(Py.Constant constant) {}

  protected void visit(Py.Attribute attribute) {
    accept(attribute.value);
  }

  protected void visit(Py.Subscript subscript) {
    accept(subscript.value);
    accept(subscript.slice);
  }

  protected void visit(Py.Starred starred) {
    accept(starred.value);
  }

  protected void visit(Py.Name name) {}

  protected void visit(Py.Sequence sequence) {
    acceptAll(sequence.elts);
  }

  protected void visit(Py.Slice slice) {
    accept(slice.lower);
    accept(slice.upper);
    accept(slice.step);
  }

  protected void visit(Py.Index index) {
    accept(index.value);
  }

  protected void visit(Py.ExtSlice extSlice) {
    acceptAll(extSlice.dims);
  }

  // helpers

  protected void visit(Py.Arguments arguments) {
    acceptAll(arguments.posonlyargs);
    acceptAll(arguments.args);
    accept(arguments.vararg);
    acceptAll(arguments.kwonlyargs);
    acceptAll(arguments.kwDefaults);
    accept(arguments.kwarg);
    acceptAll(arguments.defaults);
  }

  protected void visit(Py.Arg arg) {
    accept(arg.annotation);
  }

  protected void visit(Py.Keyword keyword) {
    accept(keyword.value);
  }

  protected void visit(Py.Alias alias) {}

  protected void visit(Py.WithItem withItem) {
    accept(withItem.contextExpr);
    accept(withItem.optionalVars);
  }

  protected void visit(Py.Comprehension comprehension) {
    accept(comprehension.target);
    accept(comprehension.iter);
    acceptAll(comprehension.ifs);
  }

  protected void visit(Py.ExceptHandler exceptHandler) {
    accept(exceptHandler.type);
    acceptAll(exceptHandler.body);
  }
}

// End Visitor.java
