package org.beng183.motifs;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One occurrence of a motif in one structure: a chain and a residue range within a model.
 * Instances are immutable. The PDB Id is always upper-case and {@code residueStart <= residueEnd}.
 * Build one with {@link #builder()}.
 * @author dmyersturnbull
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MotifInstance {

	private final String motifType;
	private final String pdbId;
	private final String chain;
	private final int modelNumber;
	private final int residueStart;
	private final int residueEnd;
	private final String sequence;
	private final Double score;
	private final String description;
	private final String sourceId;

	@JsonCreator
	MotifInstance(@JsonProperty("motifType") String motifType, @JsonProperty("pdbId") String pdbId,
			@JsonProperty("chain") String chain, @JsonProperty("modelNumber") int modelNumber,
			@JsonProperty("residueStart") int residueStart, @JsonProperty("residueEnd") int residueEnd,
			@JsonProperty("sequence") String sequence, @JsonProperty("score") Double score,
			@JsonProperty("description") String description, @JsonProperty("sourceId") String sourceId) {
		if (motifType == null || motifType.trim().isEmpty()) throw new IllegalArgumentException("Motif type is empty");
		if (pdbId == null || pdbId.trim().isEmpty()) throw new IllegalArgumentException("PDB Id is empty");
		if (chain == null) throw new IllegalArgumentException("Chain is missing for " + pdbId);
		if (sourceId == null || sourceId.isEmpty()) throw new IllegalArgumentException("Source Id is missing for " + pdbId);
		if (residueStart > residueEnd) {
			throw new IllegalArgumentException("Residue start " + residueStart + " is after residue end " + residueEnd);
		}
		this.motifType = motifType.trim();
		this.pdbId = normalizePdbId(pdbId);
		this.chain = chain;
		this.modelNumber = modelNumber;
		this.residueStart = residueStart;
		this.residueEnd = residueEnd;
		this.sequence = sequence;
		this.score = score;
		this.description = description;
		this.sourceId = sourceId;
	}

	/**
	 * Trims and upper-cases a PDB Id. Every provider applies this at its boundary.
	 */
	public static String normalizePdbId(String pdbId) {
		if (pdbId == null) throw new IllegalArgumentException("PDB Id is null");
		String normalized = pdbId.trim().toUpperCase();
		if (normalized.isEmpty()) throw new IllegalArgumentException("PDB Id is empty");
		return normalized;
	}

	public static Builder builder() {
		return new Builder();
	}

	public String getMotifType() {
		return motifType;
	}

	public String getPdbId() {
		return pdbId;
	}

	public String getChain() {
		return chain;
	}

	public int getModelNumber() {
		return modelNumber;
	}

	public int getResidueStart() {
		return residueStart;
	}

	public int getResidueEnd() {
		return residueEnd;
	}

	/**
	 * May be null.
	 */
	public String getSequence() {
		return sequence;
	}

	/**
	 * A tool-specific score or count; null if the source doesn't give one.
	 */
	public Double getScore() {
		return score;
	}

	/**
	 * May be null.
	 */
	public String getDescription() {
		return description;
	}

	/**
	 * The provider or annotation tool that produced this instance.
	 */
	public String getSourceId() {
		return sourceId;
	}

	/**
	 * @return The number of residues spanned, inclusive
	 */
	@JsonIgnore
	public int getLength() {
		return residueEnd - residueStart + 1;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof MotifInstance)) return false;
		MotifInstance other = (MotifInstance) obj;
		return modelNumber == other.modelNumber && residueStart == other.residueStart && residueEnd == other.residueEnd
				&& motifType.equals(other.motifType) && pdbId.equals(other.pdbId) && chain.equals(other.chain)
				&& Objects.equals(sequence, other.sequence) && Objects.equals(score, other.score)
				&& Objects.equals(description, other.description) && sourceId.equals(other.sourceId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(motifType, pdbId, chain, modelNumber, residueStart, residueEnd, sequence, score, description, sourceId);
	}

	@Override
	public String toString() {
		return motifType + "[" + pdbId + "|" + modelNumber + "|" + chain + "|" + residueStart + "-" + residueEnd + "] from " + sourceId;
	}

	public static class Builder {

		private String motifType;
		private String pdbId;
		private String chain;
		private int modelNumber = 1;
		private int residueStart;
		private int residueEnd;
		private String sequence;
		private Double score;
		private String description;
		private String sourceId;

		private Builder() {
		}

		public Builder motifType(String motifType) {
			this.motifType = motifType;
			return this;
		}

		public Builder pdbId(String pdbId) {
			this.pdbId = pdbId;
			return this;
		}

		public Builder chain(String chain) {
			this.chain = chain;
			return this;
		}

		public Builder modelNumber(int modelNumber) {
			this.modelNumber = modelNumber;
			return this;
		}

		public Builder residues(int start, int end) {
			this.residueStart = start;
			this.residueEnd = end;
			return this;
		}

		public Builder sequence(String sequence) {
			this.sequence = sequence == null || sequence.isEmpty() ? null : sequence;
			return this;
		}

		public Builder score(Double score) {
			this.score = score;
			return this;
		}

		public Builder description(String description) {
			this.description = description == null || description.isEmpty() ? null : description;
			return this;
		}

		public Builder sourceId(String sourceId) {
			this.sourceId = sourceId;
			return this;
		}

		/**
		 * @throws IllegalArgumentException If a required field is missing or the residue range is reversed
		 */
		public MotifInstance build() {
			return new MotifInstance(motifType, pdbId, chain, modelNumber, residueStart, residueEnd, sequence, score, description, sourceId);
		}
	}

}
