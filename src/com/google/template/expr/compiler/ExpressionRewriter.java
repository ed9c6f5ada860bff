/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.template.expr.compiler;

import static com.google.common.base.Preconditions.checkState;
import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import com.google.template.expr.ast.CompoundExpressionNode;
import com.google.template.expr.ast.CompoundExpressionNode.Child;
import com.google.template.expr.ast.ExpressionNode;
import com.google.template.expr.ast.SimpleExpressionNode;
import com.google.template.expr.compiler.ExpressionParser.ParseResult;
import com.google.template.expr.rhino.Node;
import com.google.template.expr.rhino.TokenStream;
import com.google.template.expr.sourcemap.SourceLocationRemapper;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites the free identifiers of a template expression into lookups on the render context.
 *
 * <p>{@code foo(bar, Math.max(a, 1))} inside a loop binding {@code a} becomes {@code
 * _ctx.foo(_ctx.bar, Math.max(a, 1))}. The result keeps every identifier occurrence as a separate
 * {@link SimpleExpressionNode} carrying its exact template location, spliced between the untouched
 * text of the expression.
 *
 * <p>An identifier is left alone when it is
 *
 * <ul>
 *   <li>bound inside the expression: a function name, parameter or declared variable,
 *   <li>bound by an enclosing template construct, see {@link ScopeStack},
 *   <li>an allowed global, see {@link GlobalAllowlist}, or
 *   <li>not a variable reference at all: a property name after a dot or a plain object key.
 * </ul>
 */
public final class ExpressionRewriter {

  static final DiagnosticType EXPRESSION_PARSE_ERROR =
      DiagnosticType.error(
          "TEMPLATE_EXPRESSION_PARSE_ERROR", "Error parsing JavaScript expression: {0}");

  private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");

  private final TransformContext context;

  ExpressionRewriter(TransformContext context) {
    this.context = context;
  }

  /** Rewrites an expression evaluated in the current scope. */
  public ExpressionNode rewrite(SimpleExpressionNode node) {
    return process(node, false);
  }

  /**
   * Processes a binding pattern such as a loop alias: every name it declares is kept verbatim and
   * reported through {@link ExpressionNode#getIdentifiers()}; default values are rewritten.
   */
  public ExpressionNode rewriteBindingPattern(SimpleExpressionNode node) {
    return process(node, true);
  }

  static boolean isSimpleIdentifier(String content) {
    return SIMPLE_IDENTIFIER.matcher(content).matches() && !TokenStream.isKeyword(content);
  }

  private boolean isFree(String name) {
    return !context.getScopes().isBound(name) && !context.getAllowlist().isAllowed(name);
  }

  private ExpressionNode process(SimpleExpressionNode node, boolean asParams) {
    String content = node.getContent();
    if (!context.getOptions().getPrefixIdentifiers()
        || node.isStatic()
        || content.trim().isEmpty()) {
      return node;
    }

    if (isSimpleIdentifier(content)) {
      if (asParams) {
        return new SimpleExpressionNode(
            content, false, node.getLocation(), ImmutableSet.of(content));
      }
      if (isFree(content)) {
        return new SimpleExpressionNode(
            context.getOptions().getContextPrefix() + content, false, node.getLocation());
      }
      return node;
    }

    SourceLocationRemapper remapper =
        new SourceLocationRemapper(node.getLocation().start(), content);
    ParseResult result =
        asParams
            ? ExpressionParser.parseBindingPattern(content)
            : ExpressionParser.parseExpression(content);
    if (!result.isSuccess()) {
      int errorStart = min(max(result.errorOffset(), 0), content.length());
      context.report(
          remapper.location(errorStart, content.length()),
          EXPRESSION_PARSE_ERROR,
          result.errorMessage());
      return node;
    }

    IdentifierWalker walker = new IdentifierWalker();
    Node expression = result.root().getOnlyChild();
    ImmutableSet<String> identifiers;
    if (asParams) {
      List<String> names = new ArrayList<>();
      collectBoundNames(expression, names);
      walker.enterScope(names);
      walker.walkBindingTarget(expression);
      walker.exitScope();
      identifiers = ImmutableSet.copyOf(names);
    } else {
      walker.walk(expression);
      identifiers = ImmutableSet.of();
    }

    List<Occurrence> occurrences = walker.occurrences;
    if (occurrences.isEmpty()) {
      return node;
    }
    occurrences.sort(Comparator.comparingInt(Occurrence::start));

    if (occurrences.size() == 1) {
      Occurrence only = occurrences.get(0);
      if (only.start() == 0 && only.end() == content.length() && only.shorthandKey() == null) {
        return new SimpleExpressionNode(only.content(), false, node.getLocation(), identifiers);
      }
    }

    ImmutableList.Builder<Child> children = ImmutableList.builder();
    int last = 0;
    for (Occurrence occurrence : occurrences) {
      if (occurrence.start() < last) {
        // Nested inside an occurrence already spliced.
        continue;
      }
      String leading = content.substring(last, occurrence.start());
      if (occurrence.shorthandKey() != null) {
        // { foo } has to become { foo: _ctx.foo }
        leading += occurrence.shorthandKey() + ": ";
      }
      if (!leading.isEmpty()) {
        children.add(Child.text(leading));
      }
      children.add(
          Child.expression(
              new SimpleExpressionNode(
                  occurrence.content(),
                  false,
                  remapper.location(occurrence.start(), occurrence.end()))));
      last = occurrence.end();
    }
    if (last < content.length()) {
      children.add(Child.text(content.substring(last)));
    }
    return new CompoundExpressionNode(children.build(), node.getLocation(), identifiers);
  }

  /**
   * One identifier of the expression, with the text that replaces it. A non-null {@code
   * shorthandKey} means the identifier was a rewritten shorthand property and needs its key
   * spelled out.
   */
  private record Occurrence(int start, int end, String content, @Nullable String shorthandKey) {}

  /** Adds the names declared by a binding target (a name or a destructuring pattern). */
  private static void collectBoundNames(Node n, List<String> names) {
    switch (n.getToken()) {
      case NAME:
        names.add(n.getString());
        break;
      case ARRAY_PATTERN:
      case OBJECT_PATTERN:
        for (Node child : n.children()) {
          collectBoundNames(child, names);
        }
        break;
      case DEFAULT_VALUE:
      case ITER_REST:
      case OBJECT_REST:
      case STRING_KEY:
        collectBoundNames(n.getFirstChild(), names);
        break;
      case COMPUTED_PROP:
        collectBoundNames(n.getLastChild(), names);
        break;
      default:
        break;
    }
  }

  /**
   * Walks an expression tree in source order and records each identifier occurrence. Names bound
   * inside the expression are tracked with a count per name, so a parameter shadowing another one
   * stays bound until the innermost function declaring it is left.
   */
  private final class IdentifierWalker {
    private final List<Occurrence> occurrences = new ArrayList<>();
    private final Multiset<String> localBindings = HashMultiset.create();
    private final Deque<List<String>> scopes = new ArrayDeque<>();

    void walk(Node n) {
      switch (n.getToken()) {
        case NAME:
          reference(n, null);
          break;
        case GETPROP:
        case OPTCHAIN_GETPROP:
          walk(n.getFirstChild());
          record(n.getLastChild(), n.getLastChild().getString());
          break;
        case OBJECTLIT:
          for (Node property : n.children()) {
            walkObjectProperty(property);
          }
          break;
        case FUNCTION:
          walkFunction(n);
          break;
        case BLOCK:
          // Function statements are hoisted to the top of the enclosing body.
          for (Node statement : n.children()) {
            if (statement.isFunction() && statement.getFirstChild().isName()) {
              declare(statement.getFirstChild().getString());
            }
          }
          for (Node statement : n.children()) {
            walk(statement);
          }
          break;
        case VAR:
        case LET:
        case CONST:
          // let and const are bound up to the end of the function, not of their block.
          walkDeclaration(n);
          break;
        default:
          for (Node child : n.children()) {
            walk(child);
          }
      }
    }

    private void walkObjectProperty(Node property) {
      switch (property.getToken()) {
        case STRING_KEY:
          {
            Node value = property.getOnlyChild();
            if (property.isShorthandProperty() && value.isName()) {
              reference(value, property.getString());
            } else {
              // The key is a static name and never a reference.
              walk(value);
            }
            break;
          }
        case MEMBER_FUNCTION_DEF:
          walk(property.getOnlyChild());
          break;
        default:
          // computed properties and spreads
          for (Node child : property.children()) {
            walk(child);
          }
      }
    }

    /**
     * The name of a function is bound in its own parameters and body only, not in the code around
     * the function.
     */
    private void walkFunction(Node function) {
      Node name = function.getFirstChild();
      Node params = name.getNext();
      Node body = params.getNext();

      List<String> names = new ArrayList<>();
      if (name.isName()) {
        names.add(name.getString());
        record(name, name.getString());
      }
      for (Node param : params.children()) {
        collectBoundNames(param, names);
      }
      enterScope(names);
      for (Node param : params.children()) {
        walkBindingTarget(param);
      }
      walk(body);
      exitScope();
    }

    private void walkDeclaration(Node declaration) {
      for (Node declared : declaration.children()) {
        Node target = declared.isName() ? declared : declared.getFirstChild();
        List<String> names = new ArrayList<>();
        collectBoundNames(target, names);
        for (String name : names) {
          declare(name);
        }
        walkBindingTarget(target);
        Node init = declared.isName() ? declared.getFirstChild() : target.getNext();
        if (init != null) {
          walk(init);
        }
      }
    }

    /** Records the declared names verbatim and rewrites default values and computed keys. */
    void walkBindingTarget(Node n) {
      switch (n.getToken()) {
        case NAME:
          record(n, n.getString());
          break;
        case DEFAULT_VALUE:
          walkBindingTarget(n.getFirstChild());
          walk(n.getLastChild());
          break;
        case ARRAY_PATTERN:
        case ITER_REST:
        case OBJECT_REST:
          for (Node child : n.children()) {
            walkBindingTarget(child);
          }
          break;
        case OBJECT_PATTERN:
          for (Node property : n.children()) {
            if (property.isComputedProp()) {
              walk(property.getFirstChild());
              walkBindingTarget(property.getLastChild());
            } else {
              // STRING_KEY or OBJECT_REST; a key is never recorded.
              walkBindingTarget(property.getOnlyChild());
            }
          }
          break;
        default:
          break;
      }
    }

    private void reference(Node name, @Nullable String shorthandKey) {
      String id = name.getString();
      if (!localBindings.contains(id) && isFree(id)) {
        occurrences.add(
            new Occurrence(
                name.getSourceOffset(),
                name.getSourceEnd(),
                context.getOptions().getContextPrefix() + id,
                shorthandKey));
      } else {
        record(name, id);
      }
    }

    private void record(Node n, String content) {
      occurrences.add(new Occurrence(n.getSourceOffset(), n.getSourceEnd(), content, null));
    }

    void enterScope(List<String> names) {
      scopes.push(new ArrayList<>(names));
      localBindings.addAll(names);
    }

    private void declare(String name) {
      checkState(!scopes.isEmpty(), "declaration outside of a function: %s", name);
      scopes.peek().add(name);
      localBindings.add(name);
    }

    void exitScope() {
      for (String name : scopes.pop()) {
        localBindings.remove(name);
      }
    }
  }
}
