package com.houjicha;

import com.houjicha.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Document parseClean(String source) {
        ParseResult result = Parser.parse(source);
        assertEquals(List.of(), result.errors(), "Unexpected errors for: " + source);
        return result.document();
    }

    private static Claim onlyClaim(String source) {
        Document document = parseClean(source);
        assertEquals(1, document.children().size());
        return assertInstanceOf(Claim.class, document.children().get(0));
    }

    @Test
    void testSimpleClaim() {
        Claim claim = onlyClaim("#窃盗罪");
        assertEquals("窃盗罪", claim.name());
        assertEquals(Concluded.NONE, claim.concluded());
        assertEquals("Claim", claim.type());
        assertTrue(claim.requirements().isEmpty());
        assertNull(claim.reference());
        assertNull(claim.effect());
    }

    @Test
    void testClaimReference() {
        Claim claim = onlyClaim("#窃盗罪^刑法235条");
        assertEquals("窃盗罪", claim.name());
        assertEquals("刑法235条", claim.reference().citation());
    }

    @Test
    void testConcludedMarkers() {
        assertEquals(Concluded.POSITIVE, onlyClaim("+#窃盗罪").concluded());
        assertEquals(Concluded.NEGATIVE, onlyClaim("!#窃盗罪").concluded());
    }

    @Test
    void testClaimNameKeepsWordSpacing() {
        assertEquals("甲 の 罪責", onlyClaim("#甲 の 罪責").name());
    }

    @Test
    void testRequirementBlock() {
        Claim claim = onlyClaim("#窃盗罪:\n    (他人の財物)");
        assertEquals(1, claim.requirements().size());
        assertEquals("他人の財物", claim.requirements().get(0).name());
    }

    @Test
    @DisplayName("Dedent back to column 0 does not disturb following siblings")
    void testDedentKeepsSiblings() {
        Document document = parseClean("#窃盗罪:\n    (他人の財物)\n    (窃取)\n#強盗罪:\n    (暴行)");

        List<Claim> claims = document.claims();
        assertEquals(2, claims.size());
        assertEquals(2, claims.get(0).requirements().size());
        assertEquals("窃取", claims.get(0).requirements().get(1).name());
        assertEquals("強盗罪", claims.get(1).name());
        assertEquals("暴行", claims.get(1).requirements().get(0).name());
    }

    @Test
    void testNamespace() {
        Document document = parseClean("::甲の罪責\n    #窃盗罪\n    #詐欺罪");
        Namespace namespace = assertInstanceOf(Namespace.class, document.children().get(0));

        assertEquals("Namespace", namespace.type());
        assertEquals("甲の罪責", namespace.name());
        assertEquals(2, namespace.children().size());
        assertEquals("窃盗罪", namespace.claims().get(0).name());
        assertEquals(2, document.claims().size());
    }

    @Test
    void testCompoundFact() {
        Fact fact = onlyClaim("#主張 <= (事実1 & 事実2)").fact();

        assertEquals(LogicalOperator.AND, fact.operator());
        assertEquals("and", fact.operator().toString());
        assertEquals(2, fact.children().size());
        assertEquals("事実1", fact.children().get(0).content());
        assertEquals("事実2", fact.children().get(1).content());
        assertEquals("", fact.content());
    }

    @Test
    @DisplayName("A mixed & / | chain keeps only the last connective")
    void testMixedConnectivesLastWins() {
        Fact fact = onlyClaim("#主張 <= (a & b | c)").fact();
        assertEquals(LogicalOperator.OR, fact.operator());
        assertEquals(3, fact.children().size());
    }

    @Test
    void testNestedCompoundFact() {
        Fact fact = onlyClaim("#主張 <= ((a & b) | c) @強い").fact();

        assertEquals(LogicalOperator.OR, fact.operator());
        assertEquals("強い", fact.evaluation().content());
        Fact inner = fact.children().get(0);
        assertEquals(LogicalOperator.AND, inner.operator());
        assertEquals("a", inner.children().get(0).content());
    }

    @Test
    @DisplayName("Only the first evaluation of a flat fact is kept")
    void testFirstEvaluationOnly() {
        Fact fact = onlyClaim("#主張 <= 事実 @悪質 @重大").fact();
        assertEquals("事実", fact.content());
        assertEquals("悪質", fact.evaluation().content());
        assertTrue(fact.children().isEmpty());
    }

    @Test
    void testEffectAfterBlock() {
        Claim claim = onlyClaim("#窃盗罪:\n    (財物)\n>> 10年以下の懲役");
        assertEquals(1, claim.requirements().size());
        assertEquals("10年以下の懲役", claim.effect().content());
    }

    @Test
    void testEffectInsideBlock() {
        Claim claim = onlyClaim("#窃盗罪:\n    (財物)\n    >> 懲役\n    (窃取)");
        assertEquals(2, claim.requirements().size());
        assertEquals("懲役", claim.effect().content());
    }

    @Test
    void testReasonStatements() {
        Claim claim = onlyClaim("#窃盗罪:\n    ; 甲は財物を持ち去った\n    (財物)\n        ; 自転車は財物");
        assertEquals("甲は財物を持ち去った", claim.reasonStatements().get(0).content());
        assertEquals("自転車は財物", claim.requirements().get(0).reasonStatements().get(0).content());
    }

    @Test
    void testTopLevelReasonStatementIsDropped() {
        Document document = parseClean("; 前置き\n#窃盗罪");
        assertEquals(1, document.children().size());
    }

    @Test
    void testRequirementWithInlineNorm() {
        Requirement requirement = onlyClaim("#窃盗罪:\n    (財物): %他人の占有する財物^判例 <= 自転車").requirements().get(0);

        assertEquals("財物", requirement.name());
        assertEquals("他人の占有する財物", requirement.norm().content());
        assertEquals("判例", requirement.norm().reference().citation());
        assertEquals("自転車", requirement.fact().content());
        assertSame(requirement.norm().fact(), requirement.fact());
    }

    @Test
    void testRequirementInlineFacts() {
        Claim claim = onlyClaim("#c:\n    (a) <= 事実A\n    (b): <= 事実B");
        assertEquals("事実A", claim.requirements().get(0).fact().content());
        assertEquals("事実B", claim.requirements().get(1).fact().content());
        assertNull(claim.requirements().get(1).norm());
    }

    @Test
    void testConcludedRequirement() {
        Claim claim = onlyClaim("#c:\n    +(a)\n    !(b)");
        assertEquals(Concluded.POSITIVE, claim.requirements().get(0).concluded());
        assertEquals(Concluded.NEGATIVE, claim.requirements().get(1).concluded());
    }

    @Test
    void testCornerBracketRequirement() {
        Claim claim = onlyClaim("#c:\n    「財物」");
        assertEquals("財物", claim.requirements().get(0).name());
    }

    @Test
    @DisplayName("Requirement names are joined without spaces")
    void testRequirementNameConcatenation() {
        Claim claim = onlyClaim("#c:\n    (他人の 財物)");
        assertEquals("他人の財物", claim.requirements().get(0).name());
    }

    @Test
    void testNestedRequirementsAndBlockFact() {
        Requirement requirement = onlyClaim("#c:\n    (a)\n        (b)\n        <= 事実").requirements().get(0);

        assertEquals(1, requirement.subRequirements().size());
        assertEquals("b", requirement.subRequirements().get(0).name());
        assertEquals("事実", requirement.fact().content());
    }

    @Test
    void testNormAsRequirement() {
        Requirement requirement = onlyClaim("#c:\n    +%不法領得の意思 <= 持ち去った").requirements().get(0);

        assertEquals(Concluded.POSITIVE, requirement.concluded());
        assertEquals("不法領得の意思", requirement.name());
        assertEquals(requirement.norm().content(), requirement.name());
        assertEquals("持ち去った", requirement.fact().content());
        assertEquals(requirement.norm().fact(), requirement.fact());
    }

    @Test
    void testNormBlockFactReplacesNormFact() {
        Requirement requirement = onlyClaim("#c:\n    %規範 <= 古い\n        <= 新しい").requirements().get(0);
        assertEquals("新しい", requirement.fact().content());
        assertEquals("新しい", requirement.norm().fact().content());
    }

    @Test
    void testSubNormFactIsInherited() {
        Norm norm = onlyClaim("#c:\n    %上位: %下位 <= 事実").requirements().get(0).norm();

        assertEquals("上位", norm.content());
        assertEquals("下位", norm.subNorm().content());
        assertEquals("事実", norm.fact().content());
    }

    @Test
    void testIssue() {
        Requirement requirement = onlyClaim("#c:\n    ?占有の有無 ~> 理由 => +%占有あり\n        %事実上の支配")
            .requirements().get(0);

        assertEquals("占有の有無", requirement.name());
        assertEquals(Concluded.POSITIVE, requirement.concluded());

        Issue issue = requirement.issue();
        assertEquals("占有の有無", issue.question());
        assertEquals(1, issue.reasons().size());
        assertEquals("理由", issue.reasons().get(0).content());
        assertEquals("占有あり", issue.norm().content());
        assertNull(issue.conclusion());

        // Entries of the issue's block belong to its norm
        assertEquals(1, issue.norm().subRequirements().size());
        assertEquals("事実上の支配", issue.norm().subRequirements().get(0).name());
        assertTrue(requirement.subRequirements().isEmpty());
    }

    @Test
    void testIssueReasonChain() {
        Issue issue = onlyClaim("#c:\n    ?問題 ~> (理由1 & 理由2 | 理由3) => %規範").requirements().get(0).issue();

        List<Reason> reasons = issue.reasons();
        assertEquals(3, reasons.size());
        assertEquals("理由1", reasons.get(0).content());
        assertNull(reasons.get(0).operator());
        assertEquals(LogicalOperator.AND, reasons.get(1).operator());
        assertEquals("理由3", reasons.get(2).content());
        assertEquals(LogicalOperator.OR, reasons.get(2).operator());
        assertEquals("規範", issue.norm().content());
    }

    @Test
    void testComments() {
        Document document = parseClean("// 見出し\n#窃盗罪: // 補足\n    // 要件\n    (財物) // 注\n");

        assertEquals(2, document.children().size());
        Comment comment = assertInstanceOf(Comment.class, document.children().get(0));
        assertEquals("見出し", comment.text());

        Claim claim = assertInstanceOf(Claim.class, document.children().get(1));
        assertEquals("窃盗罪", claim.name());
        assertEquals("財物", claim.requirements().get(0).name());
    }

    @Test
    void testFullWidthOperators() {
        Claim claim = onlyClaim("＃窃盗罪：\n    （財物） <= 事実");
        assertEquals("窃盗罪", claim.name());
        assertEquals("財物", claim.requirements().get(0).name());
        assertEquals("事実", claim.requirements().get(0).fact().content());
    }

    @Test
    void testRanges() {
        Document document = parseClean("#窃盗罪:\n    (財物)");
        Claim claim = document.claims().get(0);
        Requirement requirement = claim.requirements().get(0);

        assertEquals(new Position(0, 0, 0), document.range().start());
        assertEquals(new Position(0, 0, 0), claim.range().start());
        assertEquals(new Position(1, 4, 10), requirement.range().start());
        assertTrue(requirement.range().end().offset() <= claim.range().end().offset());
    }

    @Test
    void testEmptySource() {
        Document document = parseClean("");
        assertTrue(document.children().isEmpty());
        assertTrue(document.constants().isEmpty());
    }

    @Test
    @DisplayName("Parsing the same source twice yields equal documents")
    void testIdempotence() {
        String source = """
            ::甲の罪責
                #窃盗罪^刑法235条:
                    (他人の財物): %他人の占有する財物 as 財物性 <= 自転車
                    ?占有の有無 ~> (理由1 & 理由2) => %占有あり
                        $財物性
                    ; 甲は自転車を持ち去った
                >> 10年以下の懲役
            """;

        ParseResult first = Parser.parse(source);
        ParseResult second = Parser.parse(source);

        assertEquals(first.document(), second.document());
        assertEquals(first.errors(), second.errors());
        assertNotSame(first.document(), second.document());
    }

    @Test
    void testParserInstanceReturnsSameResult() {
        Parser parser = new Parser("#a");
        assertSame(parser.parse(), parser.parse());
    }
}
