package info.isaksson.erland.recordnames.extract;

import com.github.javaparser.ast.CompilationUnit;

/** Package-private parsed compilation unit, labelled with its path relative to the source root. */
record ParsedUnit(String sourcePath, CompilationUnit cu) {}
