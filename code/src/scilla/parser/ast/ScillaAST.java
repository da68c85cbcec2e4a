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
package scilla.parser.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.CommonToken;
import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;

/**
 * Tree class produced by the Scilla grammar, with helpers to avoid
 * casting children everywhere and to work out source ranges.
 */
public class ScillaAST extends CommonTree {

  public ScillaAST(Token t) {
    super(t);
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * ScillaAST everywhere
   */
  public ScillaAST child(int i) {
    return (ScillaAST)super.getChild(i);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<ScillaAST> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  public List<ScillaAST> children(int start) {
    // Return empty list if nothing in range
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children().subList(start, children.size());
  }

  /**
   * Position of the first real token in this subtree.  Imaginary tokens
   * created by tree rewrites carry no position.
   */
  public SourcePosition startPosition() {
    Token first = firstRealToken(this);
    if (first == null) {
      return SourcePosition.UNKNOWN;
    }
    return new SourcePosition(startIndex(first), first.getLine(),
                              first.getCharPositionInLine() + 1);
  }

  /**
   * Position just past the last real token in this subtree
   */
  public SourcePosition endPosition() {
    Token last = lastRealToken(this);
    if (last == null) {
      return SourcePosition.UNKNOWN;
    }
    int length = last.getText() == null ? 0 : last.getText().length();
    return new SourcePosition(startIndex(last) + length, last.getLine(),
                              last.getCharPositionInLine() + 1 + length);
  }

  private static Token firstRealToken(ScillaAST tree) {
    if (isReal(tree.getToken())) {
      return tree.getToken();
    }
    for (ScillaAST child: tree.children()) {
      Token t = firstRealToken(child);
      if (t != null) {
        return t;
      }
    }
    return null;
  }

  private static Token lastRealToken(ScillaAST tree) {
    List<ScillaAST> children = tree.children();
    for (int i = children.size() - 1; i >= 0; i--) {
      Token t = lastRealToken(children.get(i));
      if (t != null) {
        return t;
      }
    }
    return isReal(tree.getToken()) ? tree.getToken() : null;
  }

  private static boolean isReal(Token t) {
    return t != null && t.getLine() > 0;
  }

  private static int startIndex(Token t) {
    if (t instanceof CommonToken) {
      return ((CommonToken)t).getStartIndex();
    }
    return -1;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    for (int i = 0; i < indent; i++) {
      writer.print(' ');
    }
    writer.println(this.getText());
    for (ScillaAST child: children()) {
      child.printTree(writer, indent + 2);
    }
  }
}
