package org.dxworks.codesync.change;

import org.dxworks.codesync.model.Element;
import org.dxworks.codesync.model.ElementKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives test cases from a change request and the methods of its affected components. Methods get cases that
 * depend on the change type; every requirement gets one acceptance case.
 */
public class TestCaseGenerator {
    private static final int REQUIREMENT_SUMMARY_LENGTH = 30;

    public List<TestCase> generate(ChangeRequest request, List<Element> elements) {
        List<TestCase> testCases = new ArrayList<>();
        for (Element element : elements) {
            if (element.kind == ElementKind.METHOD) {
                testCases.addAll(methodCases(request, element));
            }
        }
        int number = 0;
        for (String requirement : request.requirements) {
            if (requirement != null && !requirement.isBlank()) {
                testCases.add(requirementCase(request, ++number, requirement.trim()));
            }
        }
        return testCases;
    }

    private List<TestCase> methodCases(ChangeRequest request, Element method) {
        String feature = request.featureName;
        String call = "Call " + method.signature();
        List<TestCase> cases = new ArrayList<>();
        switch (request.changeType) {
            case ADD_FEATURE:
                cases.add(testCase(caseId(method, 1), feature, "Basic function", method.name + " works normally",
                        List.of("Valid parameters"),
                        List.of(call, "Pass valid parameters"),
                        List.of("The call completes normally", "The expected result is returned")));
                cases.add(testCase(caseId(method, 2), feature, "Boundary values", method.name + " at boundary values",
                        List.of("Boundary value parameters"),
                        List.of(call, "Pass boundary value parameters"),
                        List.of("The call completes normally", "Boundary values are handled correctly")));
                cases.add(testCase(caseId(method, 3), feature, "Error handling", method.name + " with invalid input",
                        List.of("Invalid parameters"),
                        List.of(call, "Pass invalid parameters"),
                        List.of("A suitable exception is raised", "The error message is correct")));
                break;
            case MODIFY_FEATURE:
                cases.add(testCase(caseId(method, 1), feature, "Changed behaviour", method.name + " after the change",
                        List.of("Parameters affected by the change"),
                        List.of(call, "Pass parameters affected by the change"),
                        List.of("Behaves as the changed specification says",
                                "Behaviour outside the change is unaffected")));
                cases.add(testCase(caseId(method, 2), feature, "Regression", "Impact of the change on " + method.name,
                        List.of("Parameters of the behaviour before the change"),
                        List.of(call, "Pass parameters of the behaviour before the change"),
                        List.of("The previous behaviour still works", "The change has no side effects")));
                break;
            case FIX_BUG:
                cases.add(testCase(caseId(method, 1), feature, "Bug fix", "Fix of " + method.name + " is effective",
                        List.of("Reproduce the conditions of the bug"),
                        List.of(call, "Pass the parameters that triggered the bug"),
                        List.of("The bug no longer occurs", "The call completes normally")));
                cases.add(testCase(caseId(method, 2), feature, "Regression", "Impact of the fix on " + method.name,
                        List.of("Parameters of unaffected behaviour"),
                        List.of(call, "Pass parameters of unaffected behaviour"),
                        List.of("Unaffected behaviour still works", "The fix has no side effects")));
                break;
            default:
                cases.add(testCase(caseId(method, 1), feature, "Basic function", method.name + " works",
                        List.of("Usual conditions"),
                        List.of(call, "Pass suitable parameters"),
                        List.of("The call completes normally", "The expected result is returned")));
        }
        return cases;
    }

    private TestCase requirementCase(ChangeRequest request, int number, String requirement) {
        return testCase(String.format("TC-REQ-%03d", number), request.featureName, "Requirement check",
                "Requirement \"" + summarize(requirement) + "\"",
                List.of("Set up the conditions of the requirement"),
                List.of("Run the function the requirement describes", "Check the result"),
                List.of("Requirement \"" + requirement + "\" is met"));
    }

    private static String caseId(Element method, int number) {
        return String.format("TC-%s-%03d", method.name, number);
    }

    static String summarize(String requirement) {
        if (requirement.length() <= REQUIREMENT_SUMMARY_LENGTH) {
            return requirement;
        }
        return requirement.substring(0, REQUIREMENT_SUMMARY_LENGTH) + "...";
    }

    private static TestCase testCase(String id, String category, String subCategory, String item,
                                     List<String> conditions, List<String> steps, List<String> expected) {
        TestCase testCase = new TestCase(id, category, subCategory, item);
        testCase.conditions.addAll(conditions);
        testCase.steps.addAll(steps);
        testCase.expectedResults.addAll(expected);
        return testCase;
    }
}
