package com.example.contractlens.analysis;

import com.example.contractlens.domain.ExternalCall;
import com.example.contractlens.parser.ParseException;
import com.example.contractlens.parser.SourceUnitParser;
import com.example.contractlens.parser.syntax.Declaration;
import com.example.contractlens.parser.syntax.Statement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallGraphAnalyzerTest {

    private final CallGraphAnalyzer analyzer = new CallGraphAnalyzer();

    @Test
    void complexityCountsRequiresBranchesAndShortCircuits() throws ParseException {
        Statement.Block body = bodyOf("""
                function withdraw(uint256 amount) external {
                    require(amount > 0, "zero");
                    require(balances[msg.sender] >= amount);
                    require(!paused);
                    if (amount > limit && !whitelisted[msg.sender]) {
                        revert TooLarge(amount);
                    }
                    if (amount == 0) {
                        return;
                    }
                    balances[msg.sender] -= amount;
                }
                """);

        assertEquals(7, analyzer.complexity(body));
    }

    @Test
    void straightLineBodyHasComplexityOne() throws ParseException {
        Statement.Block body = bodyOf("""
                function set(uint256 v) public {
                    value = v;
                    emit Changed(v);
                }
                """);

        assertEquals(1, analyzer.complexity(body));
    }

    @Test
    void missingBodyHasComplexityOneAndNoCalls() {
        CallGraph graph = analyzer.analyze(null);

        assertEquals(1, graph.complexity());
        assertTrue(graph.calls().isEmpty());
        assertTrue(graph.externalCalls().isEmpty());
    }

    @Test
    void loopsAndTernariesAreBranches() throws ParseException {
        Statement.Block body = bodyOf("""
                function f(uint256 n) public pure returns (uint256 r) {
                    for (uint256 i = 0; i < n; i++) { r += i; }
                    while (r > 100) { r -= 1; }
                    do { r++; } while (r < 3);
                    r = r > 10 || n == 0 ? r : 0;
                }
                """);

        assertEquals(6, analyzer.complexity(body));
    }

    @Test
    void identifierCallsAreIntraContract() throws ParseException {
        Statement.Block body = bodyOf("""
                function run() public {
                    _update(msg.sender);
                    uint256 fee = computeFee(1);
                    emit Ran(helperValue());
                }
                """);

        assertThat(analyzer.calls(body)).containsExactly("_update", "computeFee", "helperValue");
        assertTrue(analyzer.externalCalls(body).isEmpty());
    }

    @Test
    void memberCallsOnVariablesAndCastsAreExternal() throws ParseException {
        Statement.Block body = bodyOf("""
                function sweep(address to) external {
                    token.transfer(to, 1);
                    IERC20(asset).approve(router, type(uint256).max);
                    (bool ok, ) = payable(to).call{value: address(this).balance}("");
                    oracle.latest().price();
                }
                """);

        assertThat(analyzer.externalCalls(body)).containsExactly(
                new ExternalCall("token", "transfer"),
                new ExternalCall("IERC20", "approve"),
                new ExternalCall("payable", "call"),
                new ExternalCall("oracle", "latest"));
    }

    private static Statement.Block bodyOf(String function) throws ParseException {
        Declaration.ContractDefinition contract = (Declaration.ContractDefinition)
                SourceUnitParser.parse("contract C {\n" + function + "}\n").members().get(0);
        return ((Declaration.FunctionDefinition) contract.members().get(0)).body();
    }
}
