package com.visprog.generator.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Palette categories of node types.
 */
@Getter
@RequiredArgsConstructor
public enum NodeCategory {
    FLOW("Flow Control", "Управление потоком"),
    FUNCTION("Functions", "Функции"),
    VARIABLE("Variables", "Переменные"),
    MATH("Math", "Математика"),
    COMPARISON("Comparison", "Сравнение"),
    LOGIC("Logic", "Логика"),
    IO("Input/Output", "Ввод/Вывод"),
    OTHER("Other", "Прочее");

    private final String label;
    private final String labelRu;
}
