package com.upstage.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathUtils 单元测试")
class PathUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {"foo", "foo-plugin", "Foo_1.2", ".hidden"})
    @DisplayName("普通目录名")
    void plainNamesShouldBeAccepted(String name) {
        assertTrue(PathUtils.isPlainDirectoryName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", ".", "..", "a/b", "a\\b", "/abs", "bad\u0000name"})
    @DisplayName("会跳出插件目录的名称")
    void unsafeNamesShouldBeRejected(String name) {
        assertFalse(PathUtils.isPlainDirectoryName(name));
    }
}
