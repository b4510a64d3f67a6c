// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package uhdmast.util;

import java.util.ArrayList;
import java.util.List;

import uhdmast.core.AstFile.Unit;

public class Util {

    /**
     * Functional list append.  This creates a fresh list containing both <code>left</code> and <code>right</code> operands.
     * @param left
     * @param right
     * @param <T>
     * @return
     */
    public static <T> List<T> append(List<T> left, List<T> right) {
        ArrayList<T> result = new ArrayList<>();
        result.addAll(left);
        result.addAll(right);
        return result;
    }

    /**
     * Select all items of a given kind from a list.
     *
     * @param items
     * @param kind
     * @param <T>
     * @return
     */
    public static <T> List<T> filter(List<? super T> items, Class<T> kind) {
        ArrayList<T> rs = new ArrayList<>();
        for (int i = 0; i != items.size(); ++i) {
            Object ith = items.get(i);
            if (kind.isInstance(ith)) {
                rs.add(kind.cast(ith));
            }
        }
        return rs;
    }

    /**
     * Order units so that every package comes before any module. Packages are
     * processed first since their constants are imported by everything else.
     *
     * @param units
     * @return
     */
    public static List<Unit> packagesFirst(List<Unit> units) {
        List<Unit> packages = new ArrayList<>();
        List<Unit> others = new ArrayList<>();
        for (Unit u : units) {
            (u instanceof Unit.Package ? packages : others).add(u);
        }
        return append(packages, others);
    }
}
