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

import com.google.template.expr.ast.ElementNode;
import com.google.template.expr.ast.ForNode;
import com.google.template.expr.ast.InterpolationNode;
import com.google.template.expr.ast.RootNode;
import com.google.template.expr.ast.TemplateIR;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@code v-for} scoping. Nodes are created in source order, which for a loop is the
 * element first and then its {@code v-for} value, and nested afterwards.
 */
@RunWith(JUnit4.class)
public final class TransformForTest extends TemplateCompilerTestCase {

  @Test
  public void testAliasesAreNotPrefixed() {
    TemplateIR ir = new TemplateIR("<div v-for=\"(i, j, k) in list\">{{ i + j + k }}{{ l }}</div>");
    RootNode root = ir.root();
    ElementNode div = ir.element("div");
    ForNode loop = ir.forNode("(i, j, k) in list");
    InterpolationNode aliases = ir.interpolation("{{ i + j + k }}");
    InterpolationNode free = ir.interpolation("{{ l }}");
    div.addChild(aliases);
    div.addChild(free);
    loop.addChild(div);
    root.addChild(loop);

    assertThat(transform(root).success).isTrue();
    assertDescribes(loop.getSource(), "<_ctx.list>");
    assertDescribes(loop.getValueAlias(), "<i>");
    assertDescribes(loop.getKeyAlias(), "<j>");
    assertDescribes(loop.getIndexAlias(), "<k>");
    assertDescribes(aliases.getContent(), "<i>", " + ", "<j>", " + ", "<k>");
    assertDescribes(free.getContent(), "<_ctx.l>");
  }

  @Test
  public void testLoopPartLocations() {
    TemplateIR ir = new TemplateIR("<div v-for=\"(i, j, k) in list\"></div>");
    RootNode root = ir.root();
    ElementNode div = ir.element("div");
    ForNode loop = ir.forNode("(i, j, k) in list");
    loop.addChild(div);
    root.addChild(loop);

    transform(root);
    assertLocation(loop.getValueAlias(), 13, 1, 14, 14, 1, 15);
    assertLocation(loop.getKeyAlias(), 16, 1, 17, 17, 1, 18);
    assertLocation(loop.getIndexAlias(), 19, 1, 20, 20, 1, 21);
    assertLocation(loop.getSource(), 25, 1, 26, 29, 1, 30);
  }

  @Test
  public void testNestedLoopShadowing() {
    TemplateIR ir =
        new TemplateIR(
            "<div v-for=\"i in list\"><div v-for=\"i in list\">{{ i + j }}</div>{{ i }}</div>");
    RootNode root = ir.root();
    ElementNode outerDiv = ir.element("div");
    ForNode outer = ir.forNode("i in list");
    ElementNode innerDiv = ir.element("div");
    ForNode inner = ir.forNode("i in list");
    InterpolationNode innerContent = ir.interpolation("{{ i + j }}");
    InterpolationNode outerContent = ir.interpolation("{{ i }}");
    innerDiv.addChild(innerContent);
    inner.addChild(innerDiv);
    outerDiv.addChild(inner);
    outerDiv.addChild(outerContent);
    outer.addChild(outerDiv);
    root.addChild(outer);

    transform(root);
    assertDescribes(innerContent.getContent(), "<i>", " + ", "<_ctx.j>");
    assertDescribes(outerContent.getContent(), "<i>");
    assertDescribes(inner.getSource(), "<_ctx.list>");
  }

  @Test
  public void testAliasesAreUnboundAfterTheLoop() {
    TemplateIR ir = new TemplateIR("<div v-for=\"i in list\"></div>{{ i }}");
    RootNode root = ir.root();
    ElementNode div = ir.element("div");
    ForNode loop = ir.forNode("i in list");
    InterpolationNode after = ir.interpolation("{{ i }}");
    loop.addChild(div);
    root.addChild(loop);
    root.addChild(after);

    transform(root);
    assertDescribes(after.getContent(), "<_ctx.i>");
  }

  @Test
  public void testSourceSeesOuterAliases() {
    TemplateIR ir =
        new TemplateIR(
            "<ul v-for=\"item in items\"><li v-for=\"child of item.children\">{{ child }}</li></ul>");
    RootNode root = ir.root();
    ElementNode ul = ir.element("ul");
    ForNode outer = ir.forNode("item in items");
    ElementNode li = ir.element("li");
    ForNode inner = ir.forNode("child of item.children");
    InterpolationNode content = ir.interpolation("{{ child }}");
    li.addChild(content);
    inner.addChild(li);
    ul.addChild(inner);
    outer.addChild(ul);
    root.addChild(outer);

    transform(root);
    assertDescribes(outer.getSource(), "<_ctx.items>");
    assertDescribes(inner.getSource(), "<item>", ".", "<children>");
    assertDescribes(content.getContent(), "<child>");
  }

  @Test
  public void testDestructuredValueAlias() {
    TemplateIR ir =
        new TemplateIR(
            "<div v-for=\"({ id, name: [first] }, index) in items\">"
                + "{{ id + first + index + other }}</div>");
    RootNode root = ir.root();
    ElementNode div = ir.element("div");
    ForNode loop = ir.forNode("({ id, name: [first] }, index) in items");
    InterpolationNode content = ir.interpolation("{{ id + first + index + other }}");
    div.addChild(content);
    loop.addChild(div);
    root.addChild(loop);

    assertThat(transform(root).success).isTrue();
    assertThat(loop.getValueAlias().getIdentifiers()).containsExactly("id", "first");
    assertThat(loop.getValueAlias().toSourceString()).isEqualTo("{ id, name: [first] }");
    assertDescribes(loop.getKeyAlias(), "<index>");
    assertThat(loop.getIndexAlias()).isNull();
    assertDescribes(
        content.getContent(),
        "<id>",
        " + ",
        "<first>",
        " + ",
        "<index>",
        " + ",
        "<_ctx.other>");
  }

  @Test
  public void testAliasDefaultValueIsRewritten() {
    TemplateIR ir = new TemplateIR("<div v-for=\"{ a = b } in list\"></div>");
    RootNode root = ir.root();
    ElementNode div = ir.element("div");
    ForNode loop = ir.forNode("{ a = b } in list");
    loop.addChild(div);
    root.addChild(loop);

    transform(root);
    assertThat(loop.getValueAlias().toSourceString()).isEqualTo("{ a = _ctx.b }");
    assertThat(loop.getValueAlias().getIdentifiers()).containsExactly("a");
  }

  @Test
  public void testMalformedExpression() {
    TemplateIR ir = new TemplateIR("<div v-for=\"items\">{{ items }}</div>{{ other }}");
    RootNode root = ir.root();
    ElementNode div = ir.element("div");
    ForNode loop = ir.forNode("items");
    InterpolationNode inside = ir.interpolation("{{ items }}");
    InterpolationNode after = ir.interpolation("{{ other }}");
    div.addChild(inside);
    loop.addChild(div);
    root.addChild(loop);
    root.addChild(after);

    Result result = transform(root);
    assertThat(result.success).isFalse();
    TemplateError error = assertOneError(TransformFor.MALFORMED_FOR_EXPRESSION);
    assertThat(error.description()).isEqualTo("v-for has invalid expression: items");
    assertThat(loop.getSource()).isNull();
    assertDescribes(inside.getContent(), "<_ctx.items>");
    assertDescribes(after.getContent(), "<_ctx.other>");
  }
}
