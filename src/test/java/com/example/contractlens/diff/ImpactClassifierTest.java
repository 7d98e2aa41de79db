package com.example.contractlens.diff;

import com.example.contractlens.domain.ContractModel;
import com.example.contractlens.domain.DiffChange;
import com.example.contractlens.domain.ExternalCall;
import com.example.contractlens.domain.SecurityImpact;
import com.example.contractlens.domain.Severity;
import com.example.contractlens.domain.StateMutability;
import com.example.contractlens.domain.Visibility;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.contractlens.diff.TestModels.contract;
import static com.example.contractlens.diff.TestModels.event;
import static com.example.contractlens.diff.TestModels.function;
import static com.example.contractlens.diff.TestModels.modifier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImpactClassifierTest {

    private final StructuralDiffer differ = new StructuralDiffer();
    private final ImpactClassifier classifier = new ImpactClassifier();

    private List<SecurityImpact> classify(ContractModel a, ContractModel b) {
        List<DiffChange> changes = differ.diffModels(a, b);
        return classifier.classifySecurityImpacts(changes, a, b);
    }

    @Test
    void removedModifierStillUsedIsHighSeverity() {
        ContractModel a = contract("Token")
                .modifiers(modifier("onlyOwner"))
                .functions(
                        function("mint", Visibility.PUBLIC, StateMutability.NONPAYABLE, List.of(), List.of(),
                                List.of("onlyOwner"), List.of()),
                        function("burn", Visibility.PUBLIC, StateMutability.NONPAYABLE, List.of(), List.of(),
                                List.of("onlyOwner"), List.of()),
                        function("name", Visibility.PUBLIC, StateMutability.VIEW, List.of()))
                .build();
        ContractModel b = contract("Token")
                .functions(
                        function("mint", Visibility.PUBLIC, StateMutability.NONPAYABLE, List.of()),
                        function("burn", Visibility.PUBLIC, StateMutability.NONPAYABLE, List.of()),
                        function("name", Visibility.PUBLIC, StateMutability.VIEW, List.of()))
                .build();

        List<SecurityImpact> impacts = classify(a, b);

        assertThat(impacts).singleElement().satisfies(impact -> {
            assertEquals(Severity.HIGH, impact.severity());
            assertEquals("Modifier \"onlyOwner\" removed", impact.change());
            assertEquals("2 function(s) used this modifier: mint, burn. Access control may be weakened.",
                    impact.impact());
        });
    }

    @Test
    void removedUnusedModifierHasNoImpact() {
        ContractModel a = contract("Token").modifiers(modifier("legacy")).build();

        assertTrue(classify(a, contract("Token").build()).isEmpty());
    }

    @Test
    void relaxedVisibilityIsMediumSeverity() {
        ContractModel a = contract("C")
                .functions(function("_sync", Visibility.INTERNAL, StateMutability.NONPAYABLE, List.of()))
                .build();
        ContractModel b = contract("C")
                .functions(function("_sync", Visibility.PUBLIC, StateMutability.NONPAYABLE, List.of()))
                .build();

        assertThat(classify(a, b)).singleElement().satisfies(impact -> {
            assertEquals(Severity.MEDIUM, impact.severity());
            assertEquals("Function \"_sync\" visibility relaxed: internal → public", impact.change());
        });
    }

    @Test
    void tightenedVisibilityHasNoImpact() {
        ContractModel a = contract("C")
                .functions(function("sync", Visibility.PUBLIC, StateMutability.NONPAYABLE, List.of()))
                .build();
        ContractModel b = contract("C")
                .functions(function("sync", Visibility.EXTERNAL, StateMutability.NONPAYABLE, List.of()))
                .build();

        assertTrue(classify(a, b).isEmpty());
    }

    @Test
    void onlyNewlyIntroducedExternalCallsAreListed() {
        ExternalCall transfer = new ExternalCall("token", "transfer");
        ExternalCall swap = new ExternalCall("router", "swap");
        ContractModel a = contract("C").functions(function(
                        "harvest", Visibility.EXTERNAL, StateMutability.NONPAYABLE, List.of(), List.of(), List.of(),
                        List.of(transfer)))
                .build();
        ContractModel b = contract("C").functions(function(
                        "harvest", Visibility.EXTERNAL, StateMutability.NONPAYABLE, List.of(), List.of(), List.of(),
                        List.of(transfer, swap)))
                .build();

        assertThat(classify(a, b)).singleElement().satisfies(impact -> {
            assertEquals(Severity.MEDIUM, impact.severity());
            assertEquals("Function \"harvest\" has 1 new external call(s)", impact.change());
            assertEquals("New external calls to: router.swap. May introduce reentrancy or trust assumptions.",
                    impact.impact());
        });
    }

    @Test
    void replacedExternalCallWithSameCountHasNoImpact() {
        ContractModel a = contract("C").functions(function(
                        "harvest", Visibility.EXTERNAL, StateMutability.NONPAYABLE, List.of(), List.of(), List.of(),
                        List.of(new ExternalCall("token", "transfer"))))
                .build();
        ContractModel b = contract("C").functions(function(
                        "harvest", Visibility.EXTERNAL, StateMutability.NONPAYABLE, List.of(), List.of(), List.of(),
                        List.of(new ExternalCall("vault", "deposit"))))
                .build();

        assertTrue(classify(a, b).isEmpty());
    }

    @Test
    void readOnlyFunctionThatStartsWritingIsEscalated() {
        ContractModel a = contract("C").functions(
                        function("quote", Visibility.EXTERNAL, StateMutability.VIEW, List.of()),
                        function("hash", Visibility.EXTERNAL, StateMutability.PURE, List.of()))
                .build();
        ContractModel b = contract("C").functions(
                        function("quote", Visibility.EXTERNAL, StateMutability.PAYABLE, List.of()),
                        function("hash", Visibility.EXTERNAL, StateMutability.NONPAYABLE, List.of()))
                .build();

        List<SecurityImpact> impacts = classify(a, b);

        assertThat(impacts).extracting(SecurityImpact::change, SecurityImpact::severity).containsExactly(
                tuple("Function \"quote\" mutability changed: view → payable", Severity.HIGH),
                tuple("Function \"hash\" mutability changed: pure → nonpayable", Severity.MEDIUM));
    }

    @Test
    void removedEventsAreAggregatedIntoOneLowImpact() {
        ContractModel a = contract("E").events(event("Deposit"), event("Withdraw"), event("Kept")).build();
        ContractModel b = contract("E").events(event("Kept")).build();

        assertThat(classify(a, b)).singleElement().satisfies(impact -> {
            assertEquals(Severity.LOW, impact.severity());
            assertEquals("2 event(s) removed: Deposit, Withdraw", impact.change());
        });
    }

    @Test
    void oneChangeCanTriggerSeveralRules() {
        ContractModel a = contract("C")
                .functions(function("peek", Visibility.INTERNAL, StateMutability.VIEW, List.of()))
                .build();
        ContractModel b = contract("C")
                .functions(function("peek", Visibility.EXTERNAL, StateMutability.PAYABLE, List.of()))
                .build();

        assertThat(classify(a, b)).extracting(SecurityImpact::severity).containsExactly(Severity.MEDIUM, Severity.HIGH);
    }
}
