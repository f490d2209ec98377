package io.endpoints.client.request;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import io.endpoints.spec.PathRepresentable;
import io.endpoints.spec.PathTemplate;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

public class PathResolverTest {

    record Test1(String string, int integer) {
    }

    record TestOptional(String string, @Nullable Integer integer) {
    }

    private static final Test1 VALUE = new Test1("first", 2);

    @Test
    void testSlashSeparatedSegments() {
        PathTemplate<Test1> template = PathTemplate.<Test1>of("testing")
                .slash(Test1::string)
                .slash(Test1::integer)
                .slash("other");
        assertEquals("testing/first/2/other", PathResolver.resolve(template, VALUE));
    }

    @Test
    void testLiteralEndingWithSlashIsNotDoubled() {
        PathTemplate<Test1> template = PathTemplate.<Test1>of("testing/").slash(Test1::string).slash(Test1::integer);
        assertEquals("testing/first/2", PathResolver.resolve(template, VALUE));
    }

    @Test
    void testBoundSegmentFirst() {
        PathTemplate<Test1> template = PathTemplate.<Test1>of(Test1::integer).slash("testing");
        assertEquals("2/testing", PathResolver.resolve(template, VALUE));

        PathTemplate<Test1> literalNumber = PathTemplate.<Test1>of("testing").slash("3");
        assertEquals("testing/3", PathResolver.resolve(literalNumber, VALUE));
    }

    @Test
    void testAppendWithoutSlash() {
        PathTemplate<Test1> template = PathTemplate.<Test1>of("testing/testPath(Thing='")
                .append(Test1::string)
                .append("')");
        assertEquals("testing/testPath(Thing='first')", PathResolver.resolve(template, VALUE));

        PathTemplate<Test1> withTrailing = template.slash(Test1::integer);
        assertEquals("testing/testPath(Thing='first')/2", PathResolver.resolve(withTrailing, VALUE));
    }

    @Test
    void testEmptyTrailingValueIsElided() {
        PathTemplate<TestOptional> template = PathTemplate.<TestOptional>of("testing/testPath(Thing='")
                .append(TestOptional::string)
                .append("')")
                .slash(TestOptional::integer);
        assertEquals("testing/testPath(Thing='first')",
                PathResolver.resolve(template, new TestOptional("first", null)));
    }

    @Test
    void testDanglingSeparatorIsTrimmed() {
        PathTemplate<TestOptional> template = PathTemplate.<TestOptional>of("user/").slash(TestOptional::integer);
        assertEquals("user", PathResolver.resolve(template, new TestOptional("x", null)));
    }

    @Test
    void testEmptyMiddleValueDoesNotDoubleSeparator() {
        PathTemplate<TestOptional> template = PathTemplate.<TestOptional>of("user/")
                .append(TestOptional::integer)
                .append("/profile");
        assertEquals("user/profile", PathResolver.resolve(template, new TestOptional("x", null)));
    }

    @Test
    void testStringLiteralOnly() {
        assertEquals("testing", PathResolver.resolve(PathTemplate.<Test1>of("testing"), VALUE));
        assertEquals("", PathResolver.resolve(PathTemplate.<Test1>empty(), VALUE));
    }

    @Test
    void testConcatenatedTemplates() {
        PathTemplate<Test1> user = PathTemplate.<Test1>of("user").slash(Test1::string);
        PathTemplate<Test1> profile = PathTemplate.<Test1>of(Test1::integer).slash("profile");
        assertEquals("user/first/2/profile", PathResolver.resolve(user.concat(profile), VALUE));
    }

    @Test
    void testValuesArePercentEncoded() {
        PathTemplate<Test1> template = PathTemplate.<Test1>of("search").slash(Test1::string);
        assertEquals("search/hello%20world%3F", PathResolver.resolve(template, new Test1("hello world?", 0)));
    }

    @Test
    void testPathRepresentableAndOptional() {
        PathRepresentable slug = () -> "already%20encoded";
        PathTemplate<Object> template = PathTemplate.of("a")
                .slash(ignored -> slug)
                .slash(ignored -> Optional.of(7L))
                .slash(ignored -> Optional.empty());
        assertEquals("a/already%20encoded/7", PathResolver.resolve(template, new Object()));
    }

    @Test
    void testUnsupportedPathValueType() {
        PathTemplate<Object> template = PathTemplate.of("a").slash(ignored -> 2.5d);
        assertThrows(IllegalArgumentException.class, () -> PathResolver.resolve(template, new Object()));
    }
}
