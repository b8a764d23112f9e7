package com.policyledger.chain;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary Merkle tree over entry content hashes. An odd node at any level is
 * paired with itself.
 */
public final class MerkleTree {

    private final HashAlgorithm algorithm;
    private final ChainHasher hasher;
    private final List<List<String>> levels;

    private MerkleTree(ChainHasher hasher, HashAlgorithm algorithm, List<List<String>> levels) {
        this.hasher = hasher;
        this.algorithm = algorithm;
        this.levels = levels;
    }

    public static MerkleTree build(ChainHasher hasher, HashAlgorithm algorithm, List<String> leafHashes) {
        List<List<String>> levels = new ArrayList<>();
        if (leafHashes.isEmpty()) {
            return new MerkleTree(hasher, algorithm, levels);
        }
        List<String> level = List.copyOf(leafHashes);
        levels.add(level);
        while (level.size() > 1) {
            List<String> parents = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                String left = level.get(i);
                String right = i + 1 < level.size() ? level.get(i + 1) : left;
                parents.add(hasher.hash(left + right, algorithm));
            }
            level = List.copyOf(parents);
            levels.add(level);
        }
        return new MerkleTree(hasher, algorithm, levels);
    }

    /** Root hash, or null for an empty tree. */
    public String rootHash() {
        return levels.isEmpty() ? null : levels.get(levels.size() - 1).get(0);
    }

    public int leafCount() {
        return levels.isEmpty() ? 0 : levels.get(0).size();
    }

    public Proof proof(int leafIndex) {
        if (leafIndex < 0 || leafIndex >= leafCount()) {
            throw new IndexOutOfBoundsException("No leaf at index " + leafIndex);
        }
        List<Sibling> siblings = new ArrayList<>();
        int index = leafIndex;
        for (int depth = 0; depth < levels.size() - 1; depth++) {
            List<String> level = levels.get(depth);
            if (index % 2 == 0) {
                String right = index + 1 < level.size() ? level.get(index + 1) : level.get(index);
                siblings.add(new Sibling(right, Position.RIGHT));
            } else {
                siblings.add(new Sibling(level.get(index - 1), Position.LEFT));
            }
            index /= 2;
        }
        return new Proof(levels.get(0).get(leafIndex), siblings, rootHash());
    }

    public boolean verify(Proof proof) {
        String current = proof.leafHash();
        for (Sibling sibling : proof.siblings()) {
            current = sibling.position() == Position.LEFT
                ? hasher.hash(sibling.hash() + current, algorithm)
                : hasher.hash(current + sibling.hash(), algorithm);
        }
        return current.equals(proof.rootHash());
    }

    public enum Position { LEFT, RIGHT }

    public record Sibling(String hash, Position position) {}

    public record Proof(String leafHash, List<Sibling> siblings, String rootHash) {}
}
