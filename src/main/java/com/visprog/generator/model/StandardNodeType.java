package com.visprog.generator.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Built-in node types. Packages may define further types by tag; those are
 * not listed here.
 */
@Getter
@RequiredArgsConstructor
public enum StandardNodeType {
    // Control flow
    START("Start", "Event Begin Play", "Начало", NodeCategory.FLOW),
    END("End", "Return", "Конец", NodeCategory.FLOW),
    RETURN("Return", "Return", "Возврат", NodeCategory.FLOW),
    BRANCH("Branch", "Branch", "Ветвление", NodeCategory.FLOW),
    FOR_LOOP("ForLoop", "For Loop", "Цикл For", NodeCategory.FLOW),
    WHILE_LOOP("WhileLoop", "While Loop", "Цикл While", NodeCategory.FLOW),
    DO_WHILE("DoWhile", "Do While", "Цикл Do-While", NodeCategory.FLOW),
    FOR_EACH("ForEach", "For Each", "Для каждого", NodeCategory.FLOW),
    SWITCH("Switch", "Switch", "Выбор", NodeCategory.FLOW),
    BREAK("Break", "Break", "Прервать", NodeCategory.FLOW),
    CONTINUE("Continue", "Continue", "Продолжить", NodeCategory.FLOW),
    SEQUENCE("Sequence", "Sequence", "Последовательность", NodeCategory.FLOW),
    PARALLEL("Parallel", "Parallel", "Параллельно", NodeCategory.FLOW),
    GATE("Gate", "Gate", "Шлюз", NodeCategory.FLOW),
    DO_N("DoN", "Do N", "Выполнить N раз", NodeCategory.FLOW),
    DO_ONCE("DoOnce", "Do Once", "Выполнить однажды", NodeCategory.FLOW),
    FLIP_FLOP("FlipFlop", "Flip Flop", "Переключатель", NodeCategory.FLOW),
    MULTI_GATE("MultiGate", "Multi Gate", "Мультишлюз", NodeCategory.FLOW),

    // Functions
    FUNCTION("Function", "Function", "Функция", NodeCategory.FUNCTION),
    FUNCTION_CALL("FunctionCall", "Call Function", "Вызов функции", NodeCategory.FUNCTION),
    EVENT("Event", "Custom Event", "Событие", NodeCategory.FUNCTION),
    FUNCTION_ENTRY("FunctionEntry", "Function Entry", "Вход функции", NodeCategory.FUNCTION),
    FUNCTION_RETURN("FunctionReturn", "Return Node", "Возврат из функции", NodeCategory.FUNCTION),
    CALL_USER_FUNCTION("CallUserFunction", "Call User Function", "Вызов пользовательской функции", NodeCategory.FUNCTION),

    // Variables
    VARIABLE("Variable", "Variable", "Переменная", NodeCategory.VARIABLE),
    GET_VARIABLE("GetVariable", "Get", "Получить", NodeCategory.VARIABLE),
    SET_VARIABLE("SetVariable", "Set", "Установить", NodeCategory.VARIABLE),

    // Math
    ADD("Add", "Add", "Сложение", NodeCategory.MATH),
    SUBTRACT("Subtract", "Subtract", "Вычитание", NodeCategory.MATH),
    MULTIPLY("Multiply", "Multiply", "Умножение", NodeCategory.MATH),
    DIVIDE("Divide", "Divide", "Деление", NodeCategory.MATH),
    MODULO("Modulo", "Modulo", "Остаток", NodeCategory.MATH),

    // Comparison
    EQUAL("Equal", "==", "Равно", NodeCategory.COMPARISON),
    NOT_EQUAL("NotEqual", "!=", "Не равно", NodeCategory.COMPARISON),
    GREATER("Greater", ">", "Больше", NodeCategory.COMPARISON),
    LESS("Less", "<", "Меньше", NodeCategory.COMPARISON),
    GREATER_EQUAL("GreaterEqual", ">=", "Больше или равно", NodeCategory.COMPARISON),
    LESS_EQUAL("LessEqual", "<=", "Меньше или равно", NodeCategory.COMPARISON),

    // Logic
    AND("And", "AND", "И", NodeCategory.LOGIC),
    OR("Or", "OR", "ИЛИ", NodeCategory.LOGIC),
    NOT("Not", "NOT", "НЕ", NodeCategory.LOGIC),

    // I/O
    PRINT("Print", "Print String", "Вывод строки", NodeCategory.IO),
    INPUT("Input", "Read Input", "Ввод", NodeCategory.IO),

    // Other
    COMMENT("Comment", "Comment", "Комментарий", NodeCategory.OTHER),
    REROUTE("Reroute", "Reroute", "Перенаправление", NodeCategory.OTHER),
    CUSTOM("Custom", "Custom Node", "Пользовательский", NodeCategory.OTHER);

    private static final Map<String, StandardNodeType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(StandardNodeType::getTag, Function.identity()));

    /**
     * Type tag as stored on graph nodes.
     */
    private final String tag;
    private final String label;
    private final String labelRu;
    private final NodeCategory category;

    public static Optional<StandardNodeType> fromTag(String tag) {
        return Optional.ofNullable(tag).map(BY_TAG::get);
    }

    public boolean is(GraphNode node) {
        return node != null && tag.equals(node.getType());
    }
}
