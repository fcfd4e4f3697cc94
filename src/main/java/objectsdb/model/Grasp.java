package objectsdb.model;

import java.util.List;
import java.util.Objects;

/**
 * A grasp of a scaled model by one hand: pre-grasp and grasp joint angles and
 * poses, plus the quality measures computed when it was planned.
 * Poses are stored as (x, y, z, qw, qx, qy, qz).
 */
public final class Grasp {
    private final Integer id;
    private final int scaledModelId;
    private final String handName;
    private final List<Double> pregraspJoints;
    private final List<Double> graspJoints;
    private final Double energy;
    private final List<Double> pregraspPose;
    private final List<Double> graspPose;
    private final Double pregraspClearance;
    private final boolean clusterRep;
    private final Double tableClearance;
    private final boolean compliantCopy;
    private final Integer compliantOriginalId;
    private final Double scaledQuality;

    private Grasp(Builder builder) {
        this.id = builder.id;
        this.scaledModelId = builder.scaledModelId;
        this.handName = Objects.requireNonNull(builder.handName, "handName is required");
        this.pregraspJoints = List.copyOf(builder.pregraspJoints);
        this.graspJoints = List.copyOf(builder.graspJoints);
        this.energy = builder.energy;
        this.pregraspPose = List.copyOf(builder.pregraspPose);
        this.graspPose = List.copyOf(builder.graspPose);
        this.pregraspClearance = builder.pregraspClearance;
        this.clusterRep = builder.clusterRep;
        this.tableClearance = builder.tableClearance;
        this.compliantCopy = builder.compliantCopy;
        this.compliantOriginalId = builder.compliantOriginalId;
        this.scaledQuality = builder.scaledQuality;
    }

    public Integer id() {
        return id;
    }

    public int scaledModelId() {
        return scaledModelId;
    }

    public String handName() {
        return handName;
    }

    public List<Double> pregraspJoints() {
        return pregraspJoints;
    }

    public List<Double> graspJoints() {
        return graspJoints;
    }

    public Double energy() {
        return energy;
    }

    public List<Double> pregraspPose() {
        return pregraspPose;
    }

    public List<Double> graspPose() {
        return graspPose;
    }

    public Double pregraspClearance() {
        return pregraspClearance;
    }

    public boolean clusterRep() {
        return clusterRep;
    }

    public Double tableClearance() {
        return tableClearance;
    }

    public boolean compliantCopy() {
        return compliantCopy;
    }

    public Integer compliantOriginalId() {
        return compliantOriginalId;
    }

    public Double scaledQuality() {
        return scaledQuality;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .scaledModelId(scaledModelId)
                .handName(handName)
                .pregraspJoints(pregraspJoints)
                .graspJoints(graspJoints)
                .energy(energy)
                .pregraspPose(pregraspPose)
                .graspPose(graspPose)
                .pregraspClearance(pregraspClearance)
                .clusterRep(clusterRep)
                .tableClearance(tableClearance)
                .compliantCopy(compliantCopy)
                .compliantOriginalId(compliantOriginalId)
                .scaledQuality(scaledQuality);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer id;
        private int scaledModelId;
        private String handName;
        private List<Double> pregraspJoints = List.of();
        private List<Double> graspJoints = List.of();
        private Double energy;
        private List<Double> pregraspPose = List.of();
        private List<Double> graspPose = List.of();
        private Double pregraspClearance;
        private boolean clusterRep;
        private Double tableClearance;
        private boolean compliantCopy;
        private Integer compliantOriginalId;
        private Double scaledQuality;

        public Builder id(Integer id) {
            this.id = id;
            return this;
        }

        public Builder scaledModelId(int scaledModelId) {
            this.scaledModelId = scaledModelId;
            return this;
        }

        public Builder handName(String handName) {
            this.handName = handName;
            return this;
        }

        public Builder pregraspJoints(List<Double> pregraspJoints) {
            this.pregraspJoints = pregraspJoints;
            return this;
        }

        public Builder graspJoints(List<Double> graspJoints) {
            this.graspJoints = graspJoints;
            return this;
        }

        public Builder energy(Double energy) {
            this.energy = energy;
            return this;
        }

        public Builder pregraspPose(List<Double> pregraspPose) {
            this.pregraspPose = pregraspPose;
            return this;
        }

        public Builder graspPose(List<Double> graspPose) {
            this.graspPose = graspPose;
            return this;
        }

        public Builder pregraspClearance(Double pregraspClearance) {
            this.pregraspClearance = pregraspClearance;
            return this;
        }

        public Builder clusterRep(boolean clusterRep) {
            this.clusterRep = clusterRep;
            return this;
        }

        public Builder tableClearance(Double tableClearance) {
            this.tableClearance = tableClearance;
            return this;
        }

        public Builder compliantCopy(boolean compliantCopy) {
            this.compliantCopy = compliantCopy;
            return this;
        }

        public Builder compliantOriginalId(Integer compliantOriginalId) {
            this.compliantOriginalId = compliantOriginalId;
            return this;
        }

        public Builder scaledQuality(Double scaledQuality) {
            this.scaledQuality = scaledQuality;
            return this;
        }

        public Grasp build() {
            return new Grasp(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Grasp grasp))
            return false;
        return id != null && Objects.equals(id, grasp.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Grasp{id=" + id + ", scaledModelId=" + scaledModelId + ", hand='" + handName
                + "', clusterRep=" + clusterRep + "}";
    }
}
