package com.codearena.harness;

import com.codearena.core.model.FunctionMetadata;
import com.codearena.core.model.TestCase;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds a self-contained Go program that runs a submission against its test
 * cases and prints a JSON array of {@code {passed, expected, actual, error}}
 * records, one per test case, as its only stdout output.
 */
@Component
public class GoHarnessGenerator {

    private static final Logger log = LoggerFactory.getLogger(GoHarnessGenerator.class);

    static final String TEMPLATE_RESOURCE = "harness/go-harness.tmpl";

    private static final List<String> HARNESS_IMPORTS =
            List.of("bytes", "encoding/json", "fmt", "math/big", "os", "reflect");

    /** Numbers stay {@code json.Number} end to end so 64-bit integers survive without float64 rounding. */
    private static final String COMPARISON = """
            type harnessResult struct {
            	Passed   bool        `json:"passed"`
            	Expected interface{} `json:"expected"`
            	Actual   interface{} `json:"actual"`
            	Error    string      `json:"error"`
            }

            func harnessRun(call func() interface{}, expectedJSON string) (res harnessResult) {
            	expected, err := harnessDecode([]byte(expectedJSON))
            	if err != nil {
            		res.Error = "invalid expected value: " + err.Error()
            		return res
            	}
            	res.Expected = expected
            	defer func() {
            		if r := recover(); r != nil {
            			res.Passed = false
            			res.Actual = nil
            			res.Error = fmt.Sprintf("panic: %v", r)
            		}
            	}()
            	actual := harnessNormalize(call())
            	res.Actual = actual
            	res.Passed = harnessCompare(actual, expected)
            	return res
            }

            func harnessDecode(data []byte) (interface{}, error) {
            	dec := json.NewDecoder(bytes.NewReader(data))
            	dec.UseNumber()
            	var out interface{}
            	err := dec.Decode(&out)
            	return out, err
            }

            // harnessNormalize maps a Go value onto its JSON shape so it compares like the decoded expectation.
            func harnessNormalize(v interface{}) interface{} {
            	data, err := json.Marshal(v)
            	if err != nil {
            		return fmt.Sprintf("%v", v)
            	}
            	out, err := harnessDecode(data)
            	if err != nil {
            		return fmt.Sprintf("%v", v)
            	}
            	return out
            }

            func harnessCompare(actual, expected interface{}) bool {
            	if harnessIsNumeric(actual) && harnessIsNumeric(expected) {
            		a, okA := new(big.Rat).SetString(fmt.Sprintf("%v", actual))
            		e, okE := new(big.Rat).SetString(fmt.Sprintf("%v", expected))
            		if okA && okE {
            			return a.Cmp(e) == 0
            		}
            		return fmt.Sprintf("%v", actual) == fmt.Sprintf("%v", expected)
            	}
            	switch e := expected.(type) {
            	case []interface{}:
            		a, ok := actual.([]interface{})
            		if !ok || len(a) != len(e) {
            			return false
            		}
            		for i := range e {
            			if !harnessCompare(a[i], e[i]) {
            				return false
            			}
            		}
            		return true
            	case map[string]interface{}:
            		a, ok := actual.(map[string]interface{})
            		if !ok || len(a) != len(e) {
            			return false
            		}
            		for k, v := range e {
            			av, present := a[k]
            			if !present || !harnessCompare(av, v) {
            				return false
            			}
            		}
            		return true
            	}
            	return reflect.DeepEqual(actual, expected)
            }

            func harnessIsNumeric(v interface{}) bool {
            	switch v.(type) {
            	case json.Number, int, int8, int16, int32, int64, uint, uint8, uint16, uint32, uint64, float32, float64:
            		return true
            	default:
            		return false
            	}
            }""";

    private final HarnessTemplate template;
    private final GoLiteralRenderer literals;

    public GoHarnessGenerator(ObjectMapper objectMapper) {
        this.template = HarnessTemplate.fromClasspath(TEMPLATE_RESOURCE);
        this.literals = new GoLiteralRenderer(objectMapper);
    }

    public String generate(String code, List<TestCase> testCases, FunctionMetadata metadata) {
        GoSourceCleaner.CleanedSource cleaned = GoSourceCleaner.clean(code);

        String program = template.render(Map.of(
                "IMPORTS", renderImports(cleaned),
                "USER_CODE", cleaned.body(),
                "COMPARISON", COMPARISON,
                "TEST_CALLS", renderTestCalls(testCases, metadata)));
        log.debug("Generated Go harness ({} chars) for {} test cases", program.length(), testCases.size());
        return program;
    }

    private String renderImports(GoSourceCleaner.CleanedSource cleaned) {
        Set<String> specs = new LinkedHashSet<>();
        HARNESS_IMPORTS.forEach(path -> specs.add("\"" + path + "\""));
        for (String spec : cleaned.imports()) {
            if (isHarnessImport(spec)) continue;
            // Go rejects unused imports, so only carry over the ones the kept code references
            String name = GoSourceCleaner.packageName(spec);
            if (name.equals("_") || name.equals(".")
                    || Pattern.compile("\\b" + Pattern.quote(name) + "\\.").matcher(cleaned.body()).find()) {
                specs.add(spec);
            }
        }
        var sb = new StringBuilder();
        for (String spec : specs) {
            sb.append('\t').append(spec).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static boolean isHarnessImport(String spec) {
        String s = spec.trim();
        return HARNESS_IMPORTS.stream().anyMatch(path -> s.equals("\"" + path + "\""));
    }

    private String renderTestCalls(List<TestCase> testCases, FunctionMetadata metadata) {
        var sb = new StringBuilder();
        for (int i = 0; i < testCases.size(); i++) {
            TestCase testCase = testCases.get(i);
            sb.append("\t// Test case ").append(i + 1).append('\n');
            sb.append("\tresults = append(results, harnessRun(func() interface{} {\n");
            sb.append("\t\treturn ").append(metadata.functionName())
              .append('(').append(renderArguments(testCase.input(), metadata)).append(")\n");
            sb.append("\t}, ").append(literals.quote(testCase.expected().toString())).append("))\n");
        }
        return sb.toString();
    }

    private String renderArguments(List<JsonNode> inputs, FunctionMetadata metadata) {
        var sb = new StringBuilder();
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(literals.render(inputs.get(i), metadata.parameterType(i)));
        }
        return sb.toString();
    }
}
