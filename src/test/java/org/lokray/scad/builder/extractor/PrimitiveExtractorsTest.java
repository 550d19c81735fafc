package org.lokray.scad.builder.extractor;

import org.junit.jupiter.api.Test;
import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.ColorNode;
import org.lokray.scad.ast.CubeNode;
import org.lokray.scad.ast.CylinderNode;
import org.lokray.scad.ast.OffsetNode;
import org.lokray.scad.ast.SphereNode;
import org.lokray.scad.builder.AstBuilder;
import org.lokray.scad.cst.CstParser;
import org.lokray.scad.error.Diagnostics;
import org.lokray.scad.evaluation.EvaluationResult;
import org.lokray.scad.util.CancellationToken;
import org.lokray.scad.util.ParserConfig;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrimitiveExtractorsTest
{
	private static <T extends AstNode> T single(String text, Class<T> type)
	{
		List<AstNode> ast = new AstBuilder(ParserConfig.defaults())
				.build(new CstParser().parse(text), new Diagnostics(), CancellationToken.NONE);
		assertThat(ast).singleElement().isInstanceOf(type);
		return type.cast(ast.get(0));
	}

	@Test
	void cubeSizeAndCenter()
	{
		CubeNode scalar = single("cube(10);", CubeNode.class);
		assertThat(scalar.getSize()).isEqualTo(EvaluationResult.number(10));
		assertThat(scalar.isCenter()).isFalse();

		CubeNode vector = single("cube([1, 2, 3], center = true);", CubeNode.class);
		assertThat(vector.getSize()).isEqualTo(EvaluationResult.numbers(1, 2, 3));
		assertThat(vector.isCenter()).isTrue();

		CubeNode bare = single("cube();", CubeNode.class);
		assertThat(bare.getSize()).isEqualTo(EvaluationResult.number(1));
	}

	@Test
	void cubeWithANonConstantSizeIsUndef()
	{
		CubeNode cube = single("cube(side);", CubeNode.class);

		assertThat(cube.getSize().isUndef()).isTrue();
	}

	@Test
	void sphereDiameterBecomesRadius()
	{
		SphereNode byDiameter = single("sphere(d = 10);", SphereNode.class);
		assertThat(byDiameter.getR()).isEqualTo(5.0);
		assertThat(byDiameter.getD()).contains(10.0);

		SphereNode byRadius = single("sphere(3, $fn = 24);", SphereNode.class);
		assertThat(byRadius.getR()).isEqualTo(3.0);
		assertThat(byRadius.getResolution().getFn()).contains(24.0);

		SphereNode bare = single("sphere();", SphereNode.class);
		assertThat(bare.getR()).isEqualTo(1.0);
	}

	@Test
	void cylinderPositionalForms()
	{
		CylinderNode cone = single("cylinder(10, 2, 1);", CylinderNode.class);
		assertThat(cone.getH()).contains(10.0);
		assertThat(cone.getR1()).contains(2.0);
		assertThat(cone.getR2()).contains(1.0);
		assertThat(cone.getR()).isEmpty();

		CylinderNode straight = single("cylinder(5, r = 2, center = true);", CylinderNode.class);
		assertThat(straight.getH()).contains(5.0);
		assertThat(straight.getR1()).contains(2.0);
		assertThat(straight.getR2()).contains(2.0);
		assertThat(straight.isCenter()).isTrue();
	}

	@Test
	void cylinderDiametersAreHalved()
	{
		CylinderNode cylinder = single("cylinder(h = 4, d1 = 6, d2 = 2);", CylinderNode.class);

		assertThat(cylinder.getR1()).contains(3.0);
		assertThat(cylinder.getR2()).contains(1.0);
		assertThat(cylinder.getD1()).contains(6.0);
	}

	@Test
	void colorByName()
	{
		ColorNode color = single("color(\"red\") cube(1);", ColorNode.class);

		assertThat(color.getColor()).isEqualTo(EvaluationResult.string("red"));
		assertThat(color.getAlpha()).isEmpty();
		assertThat(color.getChildren()).singleElement().isInstanceOf(CubeNode.class);
	}

	@Test
	void colorByRgbGetsFullAlpha()
	{
		ColorNode color = single("color([1, 0, 0]) cube(1);", ColorNode.class);

		assertThat(color.getColor()).isEqualTo(EvaluationResult.numbers(1, 0, 0, 1));
		assertThat(color.getAlpha()).isEmpty();
	}

	@Test
	void colorByRgbaKeepsAlpha()
	{
		ColorNode rgba = single("color([0, 1, 0, 0.5]) cube(1);", ColorNode.class);
		assertThat(rgba.getColor()).isEqualTo(EvaluationResult.numbers(0, 1, 0, 0.5));
		assertThat(rgba.getAlpha()).contains(0.5);

		ColorNode explicit = single("color(\"blue\", alpha = 0.25) cube(1);", ColorNode.class);
		assertThat(explicit.getAlpha()).contains(0.25);
	}

	@Test
	void offsetDefaults()
	{
		OffsetNode plain = single("offset() square(1);", OffsetNode.class);
		assertThat(plain.getR()).isEqualTo(0.0);
		assertThat(plain.getDelta()).isEqualTo(0.0);
		assertThat(plain.isChamfer()).isFalse();

		OffsetNode chamfered = single("offset(delta = 2, chamfer = true) square(1);", OffsetNode.class);
		assertThat(chamfered.getDelta()).isEqualTo(2.0);
		assertThat(chamfered.isChamfer()).isTrue();

		OffsetNode rounded = single("offset(3) square(1);", OffsetNode.class);
		assertThat(rounded.getR()).isEqualTo(3.0);
	}
}
