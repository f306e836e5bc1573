/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.sexp.core.balance;

/**
 * Результат балансировки.
 *
 * @param text     сбалансированный текст (или исходный, если чинить было нечего)
 * @param changed  отличается ли текст от исходного
 * @param inserted на сколько закрывающих скобок стало больше
 * @param removed  на сколько закрывающих скобок стало меньше
 */
public record Repair(String text, boolean changed, int inserted, int removed) {

    static Repair unchanged(String text) {
        return new Repair(text, false, 0, 0);
    }

    public String summary() {
        if (inserted > 0) {
            return String.format("inserted %d closing delimiter(s)", inserted);
        }
        if (removed > 0) {
            return String.format("removed %d closing delimiter(s)", removed);
        }
        return "moved closing delimiter(s)";
    }
}
