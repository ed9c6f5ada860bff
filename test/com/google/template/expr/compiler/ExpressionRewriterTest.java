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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.google.template.expr.ast.ExpressionNode;
import com.google.template.expr.ast.SimpleExpressionNode;
import com.google.template.expr.sourcemap.FilePosition;
import com.google.template.expr.sourcemap.SourceLocation;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link ExpressionRewriter} on expressions located at the start of a template. */
@RunWith(JUnit4.class)
public final class ExpressionRewriterTest extends TemplateCompilerTestCase {

  private final BasicErrorManager errorManager = new BasicErrorManager();
  private @Nullable TransformContext context;

  /** Created on first use so that tests can configure {@link #options} first. */
  private TransformContext context() {
    if (context == null) {
      context = new TransformContext(options, errorManager);
    }
    return context;
  }

  private static SimpleExpressionNode node(String content) {
    return new SimpleExpressionNode(
        content, false, SourceLocation.of(FilePosition.START, content));
  }

  private ExpressionNode rewrite(String content) {
    return context().getRewriter().rewrite(node(content));
  }

  private String rewriteToSource(String content) {
    return rewrite(content).toSourceString();
  }

  private ExpressionNode rewritePattern(String content) {
    return context().getRewriter().rewriteBindingPattern(node(content));
  }

  @Test
  public void testFreeIdentifier() {
    ExpressionNode result = rewrite("foo");
    assertDescribes(result, "<_ctx.foo>");
    assertLocation(result, 0, 1, 1, 3, 1, 4);
  }

  @Test
  public void testAllowedGlobalIsUnchanged() {
    SimpleExpressionNode math = node("Math");
    assertThat(context().getRewriter().rewrite(math)).isSameInstanceAs(math);
  }

  @Test
  public void testLiteralsAreUnchanged() {
    SimpleExpressionNode self = node("this");
    assertThat(context().getRewriter().rewrite(self)).isSameInstanceAs(self);
    SimpleExpressionNode literal = node("'a' + 1");
    assertThat(context().getRewriter().rewrite(literal)).isSameInstanceAs(literal);
  }

  @Test
  public void testNameBoundByEnclosingScope() {
    context().getScopes().pushFrame(ImmutableSet.of("item"));
    SimpleExpressionNode item = node("item");
    assertThat(context().getRewriter().rewrite(item)).isSameInstanceAs(item);
    assertThat(rewriteToSource("item.id + other")).isEqualTo("item.id + _ctx.other");
  }

  @Test
  public void testMemberAccess() {
    assertDescribes(rewrite("foo.bar"), "<_ctx.foo>", ".", "<bar>");
    assertThat(rewriteToSource("a?.b.c")).isEqualTo("_ctx.a?.b.c");
    assertThat(rewriteToSource("a[b]")).isEqualTo("_ctx.a[_ctx.b]");
  }

  @Test
  public void testArrowParametersShadowContext() {
    assertThat(rewriteToSource("x => x + y")).isEqualTo("x => x + _ctx.y");
    assertThat(rewriteToSource("(a, { b }) => a + b + c"))
        .isEqualTo("(a, { b }) => a + b + _ctx.c");
  }

  @Test
  public void testNestedFunctionScopes() {
    assertThat(rewriteToSource("(a) => [(a) => a, a, b]")).isEqualTo("(a) => [(a) => a, a, _ctx.b]");
    assertThat(rewriteToSource("[(a) => a, a]")).isEqualTo("[(a) => a, _ctx.a]");
  }

  @Test
  public void testFunctionNameIsBoundOnlyInside() {
    assertThat(rewriteToSource("[function foo() { return foo }, foo]"))
        .isEqualTo("[function foo() { return foo }, _ctx.foo]");
  }

  @Test
  public void testDeclarationsInFunctionBody() {
    assertThat(rewriteToSource("() => { const { a, b: [c] } = d; return a + c + e }"))
        .isEqualTo("() => { const { a, b: [c] } = _ctx.d; return a + c + _ctx.e }");
    assertThat(rewriteToSource("() => { let x = 1; var y = x; return y }"))
        .isEqualTo("() => { let x = 1; var y = x; return y }");
  }

  @Test
  public void testDeclarationInitializerIsRewritten() {
    assertThat(rewriteToSource("() => { const a = b; return a }"))
        .isEqualTo("() => { const a = _ctx.b; return a }");
    assertThat(rewriteToSource("() => { var y = z; return y }"))
        .isEqualTo("() => { var y = _ctx.z; return y }");
    assertThat(rewriteToSource("function f() { const a = b, c = d; return a + c }"))
        .isEqualTo("function f() { const a = _ctx.b, c = _ctx.d; return a + c }");
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
  }

  @Test
  public void testDeclarationLocations() {
    ExpressionNode result = rewrite("() => { let a = foo }");
    assertDescribes(result, "() => { let ", "<a>", " = ", "<_ctx.foo>", " }");
    assertLocation(child(result, 1), 12, 1, 13, 13, 1, 14);
    assertLocation(child(result, 3), 16, 1, 17, 19, 1, 20);
  }

  @Test
  public void testDeeplyNestedExpressionIsAnError() {
    String content = "(".repeat(3000) + "a" + ")".repeat(3000);
    SimpleExpressionNode deep = node(content);
    assertThat(context().getRewriter().rewrite(deep)).isSameInstanceAs(deep);
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
    assertThat(errorManager.getErrors()[0].description())
        .isEqualTo("Error parsing JavaScript expression: Expression nested too deeply");
  }

  @Test
  public void testFunctionStatementsAreHoisted() {
    assertThat(rewriteToSource("() => { f(); function f() { return g } }"))
        .isEqualTo("() => { f(); function f() { return _ctx.g } }");
  }

  @Test
  public void testShorthandPropertyIsExpanded() {
    assertDescribes(rewrite("{ foo }"), "{ foo: ", "<_ctx.foo>", " }");
  }

  @Test
  public void testShorthandPropertyOfBoundNameIsKept() {
    context().getScopes().pushFrame(ImmutableSet.of("foo"));
    assertThat(rewriteToSource("{ foo, bar }")).isEqualTo("{ foo, bar: _ctx.bar }");
  }

  @Test
  public void testObjectKeysAreNotReferences() {
    assertThat(rewriteToSource("{ foo: bar, 'baz': 1, qux() { return foo } }"))
        .isEqualTo("{ foo: _ctx.bar, 'baz': 1, qux() { return _ctx.foo } }");
    assertThat(rewriteToSource("{ [foo]: bar }")).isEqualTo("{ [_ctx.foo]: _ctx.bar }");
    assertThat(rewriteToSource("{ ...rest }")).isEqualTo("{ ..._ctx.rest }");
  }

  @Test
  public void testTemplateLiteral() {
    assertThat(rewriteToSource("`${a}b${c.d}`")).isEqualTo("`${_ctx.a}b${_ctx.c.d}`");
  }

  @Test
  public void testRegExpLiteral() {
    assertThat(rewriteToSource("/a/.test(b)")).isEqualTo("/a/.test(_ctx.b)");
  }

  @Test
  public void testStatementsOutsideFunctions() {
    assertThat(rewriteToSource("count++")).isEqualTo("_ctx.count++");
    assertThat(rewriteToSource("a = b")).isEqualTo("_ctx.a = _ctx.b");
    assertThat(rewriteToSource("ok ? yes : no")).isEqualTo("_ctx.ok ? _ctx.yes : _ctx.no");
  }

  @Test
  public void testChildLocationsSpanLines() {
    ExpressionNode result = rewrite("foo +\n  bar");
    assertDescribes(result, "<_ctx.foo>", " +\n  ", "<_ctx.bar>");
    assertLocation(child(result, 0), 0, 1, 1, 3, 1, 4);
    assertLocation(child(result, 2), 8, 2, 3, 11, 2, 6);
    assertLocation(result, 0, 1, 1, 11, 2, 6);
  }

  @Test
  public void testCustomContextPrefix() {
    options.setContextPrefix("$data.");
    assertThat(rewriteToSource("foo + 1")).isEqualTo("$data.foo + 1");
    assertDescribes(rewrite("foo"), "<$data.foo>");
  }

  @Test
  public void testExtendedAllowlist() {
    options.addAllowedGlobals("window");
    assertThat(rewriteToSource("window.alert(msg)")).isEqualTo("window.alert(_ctx.msg)");
  }

  @Test
  public void testPrefixingDisabled() {
    options.setPrefixIdentifiers(false);
    SimpleExpressionNode expression = node("foo + bar");
    assertThat(context().getRewriter().rewrite(expression)).isSameInstanceAs(expression);
  }

  @Test
  public void testStaticAndBlankNodesAreUnchanged() {
    SimpleExpressionNode staticNode =
        new SimpleExpressionNode("foo", true, SourceLocation.of(FilePosition.START, "foo"));
    assertThat(context().getRewriter().rewrite(staticNode)).isSameInstanceAs(staticNode);
    SimpleExpressionNode blank = node("  ");
    assertThat(context().getRewriter().rewrite(blank)).isSameInstanceAs(blank);
  }

  @Test
  public void testParseError() {
    SimpleExpressionNode broken = node("a(");
    assertThat(context().getRewriter().rewrite(broken)).isSameInstanceAs(broken);

    assertThat(errorManager.getErrorCount()).isEqualTo(1);
    TemplateError error = errorManager.getErrors()[0];
    assertThat(error.type()).isEqualTo(ExpressionRewriter.EXPRESSION_PARSE_ERROR);
    assertThat(error.description())
        .isEqualTo("Error parsing JavaScript expression: Expected ')'");
    assertThat(error.sourceName()).isEqualTo(SOURCE_NAME);
    assertThat(error.lineno()).isEqualTo(1);
    assertThat(error.charno()).isEqualTo(3);
    assertThat(error.offset()).isEqualTo(2);
  }

  @Test
  public void testBindingPatternName() {
    ExpressionNode result = rewritePattern("item");
    assertDescribes(result, "<item>");
    assertThat(result.getIdentifiers()).containsExactly("item");
  }

  @Test
  public void testBindingPatternDefaultsAreRewritten() {
    ExpressionNode result = rewritePattern("{ a, b = c, d: [e, ...f] }");
    assertThat(result.toSourceString()).isEqualTo("{ a, b = _ctx.c, d: [e, ...f] }");
    assertThat(result.getIdentifiers()).containsExactly("a", "b", "e", "f").inOrder();
  }

  @Test
  public void testBindingPatternDefaultSeesEarlierNames() {
    ExpressionNode result = rewritePattern("{ a, b = a }");
    assertThat(result.toSourceString()).isEqualTo("{ a, b = a }");
  }

  @Test
  public void testBindingPatternRejectsExpressions() {
    SimpleExpressionNode expression = node("a + b");
    assertThat(context().getRewriter().rewriteBindingPattern(expression))
        .isSameInstanceAs(expression);
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testIsSimpleIdentifier() {
    assertThat(ExpressionRewriter.isSimpleIdentifier("foo")).isTrue();
    assertThat(ExpressionRewriter.isSimpleIdentifier("$el")).isTrue();
    assertThat(ExpressionRewriter.isSimpleIdentifier("_a1")).isTrue();
    assertThat(ExpressionRewriter.isSimpleIdentifier("1a")).isFalse();
    assertThat(ExpressionRewriter.isSimpleIdentifier("a.b")).isFalse();
    assertThat(ExpressionRewriter.isSimpleIdentifier("this")).isFalse();
  }
}
