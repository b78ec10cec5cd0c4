package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstFlags;
import org.dxworks.phpast.ast.AstKind;
import org.dxworks.phpast.ast.AstNode;
import org.dxworks.phpast.ast.AstVersion;
import org.dxworks.phpast.ast.NodeFactory;
import org.dxworks.phpast.ast.UnsupportedAstVersionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeFlagMapperTest {

    @Test
    void primitiveNamesBecomeTypes() {
        AstNode type = TypeFlagMapper.typeNode("Int", 3, 50);

        assertEquals(AstKind.TYPE, type.getKind());
        assertEquals(AstFlags.TYPE_LONG, type.getFlags());
        assertEquals(3, type.getLineno());
        assertEquals(AstFlags.TYPE_ITERABLE, TypeFlagMapper.typeNode("iterable", 1, 50).getFlags());
        assertEquals(AstFlags.TYPE_VOID, TypeFlagMapper.typeNode("void", 1, 40).getFlags());
    }

    @Test
    void objectIsAClassNameBeforeVersion45() {
        AstNode v50 = TypeFlagMapper.typeNode("object", 1, 50);
        AstNode v40 = TypeFlagMapper.typeNode("object", 1, 40);

        assertEquals(AstKind.TYPE, v50.getKind());
        assertEquals(AstFlags.TYPE_OBJECT, v50.getFlags());
        assertEquals(AstKind.NAME, v40.getKind());
        assertEquals(AstFlags.NAME_NOT_FQ, v40.getFlags());
        assertEquals("object", v40.getChild("name"));
    }

    @Test
    void classNamesBecomeNames() {
        AstNode name = TypeFlagMapper.typeNode("\\Foo\\Bar", 2, 50);

        assertEquals(AstKind.NAME, name.getKind());
        assertEquals(AstFlags.NAME_FQ, name.getFlags());
        assertEquals("Foo\\Bar", name.getChild("name"));
    }

    @Test
    void unsupportedVersionIsRejected() {
        assertThrows(UnsupportedAstVersionException.class, () -> TypeFlagMapper.typeNode("int", 1, 45));
    }

    @Test
    void nameQualification() {
        NodeFactory factory = new NodeFactory(AstVersion.V50);

        assertEquals(AstFlags.NAME_NOT_FQ, TypeFlagMapper.nameNode("Foo", 1, factory).getFlags());
        AstNode relative = TypeFlagMapper.nameNode("namespace\\Foo", 1, factory);
        assertEquals(AstFlags.NAME_RELATIVE, relative.getFlags());
        assertEquals("Foo", relative.getChild("name"));
    }

    @Test
    void nullableWrapsTheInnerType() {
        NodeFactory factory = new NodeFactory(AstVersion.V50);
        AstNode inner = TypeFlagMapper.typeNode("string", 4, 50);

        AstNode nullable = TypeFlagMapper.nullableType(inner, 4, factory);

        assertEquals(AstKind.NULLABLE_TYPE, nullable.getKind());
        assertSame(inner, nullable.getChild("type"));
    }

    @Test
    void visibilityDefaultsToPublicOnlyWhenAsked() {
        assertEquals(AstFlags.MODIFIER_PUBLIC | AstFlags.MODIFIER_STATIC,
                TypeFlagMapper.visibilityFlags(List.of("static"), true));
        assertEquals(AstFlags.MODIFIER_STATIC, TypeFlagMapper.visibilityFlags(List.of("static"), false));
        assertEquals(AstFlags.MODIFIER_PRIVATE | AstFlags.MODIFIER_FINAL,
                TypeFlagMapper.visibilityFlags(List.of("final", "PRIVATE"), true));
    }

    @Test
    void classModifiers() {
        assertEquals(AstFlags.CLASS_ABSTRACT, TypeFlagMapper.classFlags(List.of("abstract")));
        assertEquals(AstFlags.CLASS_FINAL, TypeFlagMapper.classFlags(List.of("final")));
        assertEquals(0, TypeFlagMapper.classFlags(List.of()));
    }
}
