package com.spicegui.circuit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Union-find sobre claves arbitrarias (terminales, puntos de la rejilla, nombres de red).
 * <p>
 * Cada clave recibe un índice denso la primera vez que aparece; los padres viven en un
 * {@code int[]} (unión por rango, compresión por división a la mitad). Una instancia
 * sirve para una sola construcción y no se comparte entre hilos.
 */
public final class DisjointSet<K> {

    private final Map<K, Integer> index = new HashMap<>();
    private final List<K> keys = new ArrayList<>();
    private int[] parent = new int[16];
    private byte[] rank = new byte[16];

    /** Registra la clave (si no existía) y devuelve su índice. */
    public int add(K key) {
        Integer i = index.get(key);
        if (i != null) return i;
        int id = keys.size();
        if (id == parent.length) {
            parent = Arrays.copyOf(parent, id * 2);
            rank = Arrays.copyOf(rank, id * 2);
        }
        parent[id] = id;
        rank[id] = 0;
        keys.add(key);
        index.put(key, id);
        return id;
    }

    public boolean contains(K key) {
        return index.containsKey(key);
    }

    public int size() {
        return keys.size();
    }

    /** Une los conjuntos de ambas claves, registrándolas si hace falta. */
    public void union(K a, K b) {
        int ra = findIndex(add(a));
        int rb = findIndex(add(b));
        if (ra == rb) return;
        if (rank[ra] < rank[rb]) {
            parent[ra] = rb;
        } else if (rank[ra] > rank[rb]) {
            parent[rb] = ra;
        } else {
            parent[rb] = ra;
            rank[ra]++;
        }
    }

    /** Representante de la clave; la clave debe estar registrada. */
    public K find(K key) {
        Integer i = index.get(key);
        if (i == null) throw new IllegalArgumentException("Clave no registrada: " + key);
        return keys.get(findIndex(i));
    }

    public boolean connected(K a, K b) {
        Integer ia = index.get(a), ib = index.get(b);
        if (ia == null || ib == null) return false;
        return findIndex(ia) == findIndex(ib);
    }

    private int findIndex(int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    /**
     * Particiona todas las claves registradas. Los grupos salen en el orden en que
     * apareció su primera clave, y dentro de cada grupo las claves conservan el orden de registro.
     */
    public List<List<K>> groups() {
        Map<Integer, List<K>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            byRoot.computeIfAbsent(findIndex(i), r -> new ArrayList<>()).add(keys.get(i));
        }
        List<List<K>> out = new ArrayList<>(byRoot.size());
        for (List<K> g : byRoot.values()) out.add(Collections.unmodifiableList(g));
        return out;
    }
}
