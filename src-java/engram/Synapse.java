package engram;

import java.util.Locale;

/**
 * Directed weighted edge between two neurons.
 *
 * <p>Weight is kept inside the owning graph's bounds; age counts the
 * maintenance passes the edge has survived.
 */
public final class Synapse {

    private final String source;
    private final String target;
    private double weight;
    private int age;

    public Synapse(String source, String target, double weight, int age) {
        this.source = source;
        this.target = target;
        this.weight = weight;
        this.age = age;
    }

    public String getSource() { return source; }
    public String getTarget() { return target; }
    public double getWeight() { return weight; }
    public int getAge() { return age; }

    void setWeight(double weight) {
        this.weight = weight;
    }

    void incrementAge() {
        age++;
    }

    Synapse copy() {
        return new Synapse(source, target, weight, age);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Synapse{%s -> %s, weight=%.4f, age=%d}", source, target, weight, age);
    }
}
