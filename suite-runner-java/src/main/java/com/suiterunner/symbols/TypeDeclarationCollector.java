package com.suiterunner.symbols;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;

import java.util.ArrayList;
import java.util.List;

/**
 * Visitor that collects the binary names ({@code pkg.Outer$Inner}) of every
 * top-level and member type declared in a compilation unit. Local and anonymous
 * classes are skipped: they cannot be loaded by name.
 *
 * The visitor argument carries the binary name of the enclosing type, or null at top level.
 */
public class TypeDeclarationCollector extends VoidVisitorAdapter<String> {

    private final List<String> typeNames = new ArrayList<>();
    private String packagePrefix = "";

    public List<String> getTypeNames() { return typeNames; }

    public static List<String> collect(CompilationUnit cu) {
        TypeDeclarationCollector collector = new TypeDeclarationCollector();
        cu.accept(collector, null);
        return collector.getTypeNames();
    }

    @Override
    public void visit(CompilationUnit cu, String enclosing) {
        packagePrefix = cu.getPackageDeclaration()
            .map(pd -> pd.getNameAsString() + ".")
            .orElse("");
        super.visit(cu, enclosing);
    }

    @Override
    public void visit(ClassOrInterfaceDeclaration node, String enclosing) {
        if (isMember(node)) super.visit(node, addType(node, enclosing));
    }

    @Override
    public void visit(EnumDeclaration node, String enclosing) {
        if (isMember(node)) super.visit(node, addType(node, enclosing));
    }

    @Override
    public void visit(RecordDeclaration node, String enclosing) {
        if (isMember(node)) super.visit(node, addType(node, enclosing));
    }

    @Override
    public void visit(AnnotationDeclaration node, String enclosing) {
        if (isMember(node)) super.visit(node, addType(node, enclosing));
    }

    private String addType(TypeDeclaration<?> node, String enclosing) {
        String name = enclosing == null
            ? packagePrefix + node.getNameAsString()
            : enclosing + "$" + node.getNameAsString();
        typeNames.add(name);
        return name;
    }

    private static boolean isMember(Node node) {
        Node parent = node.getParentNode().orElse(null);
        return parent instanceof CompilationUnit || parent instanceof TypeDeclaration;
    }
}
