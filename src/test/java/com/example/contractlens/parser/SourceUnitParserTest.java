package com.example.contractlens.parser;

import com.example.contractlens.domain.ContractKind;
import com.example.contractlens.domain.FunctionKind;
import com.example.contractlens.domain.StateMutability;
import com.example.contractlens.domain.Visibility;
import com.example.contractlens.parser.syntax.Declaration;
import com.example.contractlens.parser.syntax.Expression;
import com.example.contractlens.parser.syntax.SourceUnit;
import com.example.contractlens.parser.syntax.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceUnitParserTest {

    @Test
    void parsesDirectivesAndContractHeader() throws ParseException {
        SourceUnit unit = SourceUnitParser.parse("""
                pragma solidity >=0.8.0 <0.9.0;
                import {A as B, C} from "./lib.sol";
                import * as Lib from "./all.sol";
                abstract contract Token is Base(1, "x"), Other {
                }
                """);

        assertTrue(unit.diagnostics().isEmpty(), "Well-formed source should not produce diagnostics.");
        assertEquals(new Declaration.PragmaDirective("solidity", ">=0.8.0 <0.9.0"), unit.members().get(0));
        assertEquals(new Declaration.ImportDirective("./lib.sol", List.of("A", "C"), null), unit.members().get(1));
        assertEquals(new Declaration.ImportDirective("./all.sol", List.of(), "Lib"), unit.members().get(2));

        Declaration.ContractDefinition contract = (Declaration.ContractDefinition) unit.members().get(3);
        assertEquals("Token", contract.name());
        assertEquals(ContractKind.ABSTRACT, contract.kind());
        assertThat(contract.baseContracts()).extracting(Declaration.InheritanceSpecifier::namePath)
                .containsExactly("Base", "Other");
        assertEquals(2, contract.baseContracts().get(0).arguments().size());
    }

    @Test
    void parsesFunctionAttributesAndSpecialFunctions() throws ParseException {
        SourceUnit unit = SourceUnitParser.parse("""
                contract Wallet {
                    constructor(address owner_) payable {}
                    function pay(address payable to, uint amount) external onlyOwner nonReentrant returns (bool ok) {
                        return true;
                    }
                    function peek() public virtual override(Base) constant returns (uint256);
                    receive() external payable {}
                    fallback() external {}
                    function() payable {}
                }
                """);

        Declaration.ContractDefinition contract = (Declaration.ContractDefinition) unit.members().get(0);
        List<Declaration.FunctionDefinition> functions = contract.members().stream()
                .map(Declaration.FunctionDefinition.class::cast)
                .toList();

        assertThat(functions).extracting(Declaration.FunctionDefinition::kind).containsExactly(
                FunctionKind.CONSTRUCTOR,
                FunctionKind.FUNCTION,
                FunctionKind.FUNCTION,
                FunctionKind.RECEIVE,
                FunctionKind.FALLBACK,
                FunctionKind.FALLBACK);
        assertEquals("", functions.get(0).name());
        assertEquals(StateMutability.PAYABLE, functions.get(0).mutability());

        Declaration.FunctionDefinition pay = functions.get(1);
        assertEquals("pay", pay.name());
        assertEquals(Visibility.EXTERNAL, pay.visibility());
        assertNull(pay.mutability());
        assertEquals("address payable", pay.parameters().get(0).typeName().render());
        assertThat(pay.modifiers()).extracting(Declaration.ModifierInvocation::name)
                .containsExactly("onlyOwner", "nonReentrant");
        assertEquals("ok", pay.returns().get(0).name());

        Declaration.FunctionDefinition peek = functions.get(2);
        assertTrue(peek.virtual());
        assertEquals(StateMutability.VIEW, peek.mutability());
        assertNull(peek.body(), "A declaration ending in ';' has no body.");
    }

    @Test
    void parsesStateVariablesWithComposedTypes() throws ParseException {
        SourceUnit unit = SourceUnitParser.parse("""
                contract Store {
                    mapping(address => mapping(uint256 => bool)) private seen;
                    uint256[] public values;
                    bytes32[4] internal constant SLOTS = [bytes32(0), 0, 0, 0];
                    address immutable owner;
                }
                """);

        List<Declaration.StateVariableDeclaration> variables =
                ((Declaration.ContractDefinition) unit.members().get(0)).members().stream()
                        .map(Declaration.StateVariableDeclaration.class::cast)
                        .toList();

        assertThat(variables).extracting(variable -> variable.typeName().render()).containsExactly(
                "mapping(address => mapping(uint256 => bool))", "uint256[]", "bytes32[4]", "address");
        assertEquals(Visibility.PRIVATE, variables.get(0).visibility());
        assertTrue(variables.get(2).constant());
        assertTrue(variables.get(3).immutable());
        assertNull(variables.get(3).visibility());
    }

    @Test
    void parsesStatementsInsideFunctionBodies() throws ParseException {
        SourceUnit unit = SourceUnitParser.parse("""
                contract Flow {
                    function run(uint256[] memory xs) public returns (uint256 total) {
                        (uint256 a, , bool ok) = helper();
                        for (uint256 i = 0; i < xs.length; i++) {
                            unchecked { total += xs[i]; }
                        }
                        try target.call{value: 1 ether}("") returns (bool success) {
                            emit Done(success);
                        } catch Error(string memory reason) {
                            revert Failed(reason);
                        } catch {
                        }
                        assembly { let x := mload(0x40) }
                        delete values[0];
                    }
                }
                """);

        assertTrue(unit.diagnostics().isEmpty(), "Unexpected diagnostics: " + unit.diagnostics());
        Declaration.FunctionDefinition run = (Declaration.FunctionDefinition)
                ((Declaration.ContractDefinition) unit.members().get(0)).members().get(0);
        List<Statement> statements = run.body().statements();

        assertThat(statements).hasSize(5);
        Statement.VariableDeclarationStatement tuple =
                assertInstanceOf(Statement.VariableDeclarationStatement.class, statements.get(0));
        assertEquals(3, tuple.variables().size());
        assertNull(tuple.variables().get(1));

        Statement.ForStatement loop = assertInstanceOf(Statement.ForStatement.class, statements.get(1));
        Statement.Block loopBody = (Statement.Block) loop.body();
        assertTrue(((Statement.Block) loopBody.statements().get(0)).unchecked());

        Statement.TryStatement attempt = assertInstanceOf(Statement.TryStatement.class, statements.get(2));
        assertEquals(2, attempt.catchClauses().size());
        assertEquals("Error", attempt.catchClauses().get(0).identifier());
        Expression.FunctionCall call = (Expression.FunctionCall) attempt.expression();
        assertInstanceOf(Expression.CallOptions.class, call.expression());

        Statement.InlineAssemblyStatement assembly =
                assertInstanceOf(Statement.InlineAssemblyStatement.class, statements.get(3));
        assertThat(assembly.raw()).startsWith("{").endsWith("}").contains("mload");

        Statement.ExpressionStatement deletion =
                assertInstanceOf(Statement.ExpressionStatement.class, statements.get(4));
        assertEquals("delete", ((Expression.UnaryOperation) deletion.expression()).operator());
    }

    @Test
    void binaryOperatorsFollowPrecedence() throws ParseException {
        SourceUnit unit = SourceUnitParser.parse("""
                contract Math {
                    function f() public pure returns (bool) {
                        return a + b * c == d && e || g;
                    }
                }
                """);

        Declaration.FunctionDefinition f = (Declaration.FunctionDefinition)
                ((Declaration.ContractDefinition) unit.members().get(0)).members().get(0);
        Statement.ReturnStatement ret = (Statement.ReturnStatement) f.body().statements().get(0);

        Expression.BinaryOperation or = (Expression.BinaryOperation) ret.expression();
        assertEquals("||", or.operator());
        Expression.BinaryOperation and = (Expression.BinaryOperation) or.left();
        assertEquals("&&", and.operator());
        Expression.BinaryOperation equality = (Expression.BinaryOperation) and.left();
        assertEquals("==", equality.operator());
        Expression.BinaryOperation sum = (Expression.BinaryOperation) equality.left();
        assertEquals("+", sum.operator());
        assertEquals("*", ((Expression.BinaryOperation) sum.right()).operator());
    }

    @Test
    void malformedMemberIsSkippedAndParsingContinues() throws ParseException {
        SourceUnit unit = SourceUnitParser.parse("""
                contract Broken {
                    uint256 public total
                    function ok() external {}
                }
                contract After {}
                """);

        assertThat(unit.diagnostics()).isNotEmpty();
        assertEquals(3, unit.diagnostics().get(0).line());

        Declaration.ContractDefinition broken = (Declaration.ContractDefinition) unit.members().get(0);
        assertThat(broken.members()).hasSize(1);
        assertEquals("ok", ((Declaration.FunctionDefinition) broken.members().get(0)).name());
        assertEquals("After", ((Declaration.ContractDefinition) unit.members().get(1)).name());
    }

    @Test
    void malformedStatementIsSkippedInsideBlock() throws ParseException {
        SourceUnit unit = SourceUnitParser.parse("""
                contract C {
                    function f() public {
                        x = ;
                        y = 2;
                    }
                }
                """);

        assertThat(unit.diagnostics()).isNotEmpty();
        assertEquals(3, unit.diagnostics().get(0).line());
        Declaration.FunctionDefinition f = (Declaration.FunctionDefinition)
                ((Declaration.ContractDefinition) unit.members().get(0)).members().get(0);
        assertThat(f.body().statements()).hasSize(1);
    }

    @Test
    void unclosedContractIsReportedAtEndOfInput() throws ParseException {
        SourceUnit unit = SourceUnitParser.parse("contract Open {\n  function f() public {}\n");

        assertThat(unit.diagnostics()).extracting(diagnostic -> diagnostic.message())
                .anyMatch(message -> message.startsWith("Missing '}'"));
        Declaration.ContractDefinition open = (Declaration.ContractDefinition) unit.members().get(0);
        assertThat(open.members()).hasSize(1);
    }

    @Test
    void literalsAreUnescapedAndCommentsIgnored() throws ParseException {
        SourceUnit unit = SourceUnitParser.parse("""
                /// @notice NatSpec is a comment too
                contract Text {
                    /* block
                       comment */
                    string constant GREETING = 'it\\'s' "a\\nb";
                    uint256 constant BIG = 1_000 ether; // trailing
                }
                """);

        assertTrue(unit.diagnostics().isEmpty(), "Unexpected diagnostics: " + unit.diagnostics());
        List<Declaration> members = ((Declaration.ContractDefinition) unit.members().get(0)).members();
        Expression.Literal greeting = (Expression.Literal)
                ((Declaration.StateVariableDeclaration) members.get(0)).initialValue();
        assertEquals(Expression.LiteralKind.STRING, greeting.kind());
        assertEquals("it's" + "a\nb", greeting.value());
        Expression.Literal big = (Expression.Literal)
                ((Declaration.StateVariableDeclaration) members.get(1)).initialValue();
        assertEquals("1_000 ether", big.value());
    }

    @Test
    void unterminatedStringFailsWithPosition() {
        ParseException e = assertThrows(ParseException.class, () -> SourceUnitParser.parse("string s = \"abc;\n"));

        assertEquals(1, e.getLine());
        assertEquals(12, e.getColumn());
        assertThat(e.getMessage()).contains("Unterminated string literal");
    }

    @Test
    void unterminatedBlockCommentFails() {
        ParseException e = assertThrows(
                ParseException.class, () -> SourceUnitParser.parse("contract A {}\n/* never closed"));

        assertEquals(2, e.getLine());
        assertEquals("Unterminated block comment", e.getReason());
    }

    @Test
    void unknownCharacterFails() {
        ParseException e = assertThrows(ParseException.class, () -> SourceUnitParser.parse("uint256 # x;"));

        assertEquals(1, e.getLine());
        assertEquals(9, e.getColumn());
    }

    @Test
    void bracketNestingBeyondLimitFails() {
        String source = "contract C { function f() public { x = "
                + "(".repeat(3000) + "1" + ")".repeat(3000) + "; } }";

        ParseException e = assertThrows(ParseException.class, () -> SourceUnitParser.parse(source));

        assertEquals("Nesting deeper than " + SourceUnitParser.MAX_NESTING_DEPTH + " levels", e.getReason());
    }

    @Test
    void longOperatorChainFailsInsteadOfOverflowing() {
        String source = "contract C { function f() public { x = " + "a + ".repeat(5_000) + "a; } }";

        ParseException e = assertThrows(ParseException.class, () -> SourceUnitParser.parse(source));

        assertThat(e.getReason()).contains("nests");
    }

    @Test
    void nestingWithinLimitParses() throws ParseException {
        String source = "contract C { function f() public { x = "
                + "(".repeat(100) + "1" + ")".repeat(100) + "; } }";

        SourceUnit unit = SourceUnitParser.parse(source);

        assertTrue(unit.diagnostics().isEmpty(), "Unexpected diagnostics: " + unit.diagnostics());
    }
}
