package org.lokray.scad.semantic;

/**
 * OpenSCAD keeps modules, functions and variables apart: {@code module a()}, {@code function a()} and
 * {@code a = 1} may all coexist in one scope.
 */
public enum Namespace
{
	MODULE,
	FUNCTION,
	VARIABLE
}
