package mchmm.util;

import org.apache.commons.math3.stat.StatUtils;

public class Algebra {

	private Algebra() {}

	/***
	 * index of the largest element, ties resolved to the lowest index
	 * @param array
	 * @return -1 if the array is empty
	 */
	public static int maxIndex(double[] array) {
		if(array.length<1) return -1;
		double d = array[0];
		int index = 0;
		for(int i=1; i<array.length; i++) {
			if(array[i]>d) {
				d = array[i];
				index = i;
			}
		}
		return index;
	}

	/***
	 * divide the array by its sum in place
	 * @param array
	 * @return the sum before normalisation, the array is untouched if it is not positive and finite
	 */
	public static double normalize(double[] array) {
		double s = StatUtils.sum(array);
		if(!isPositiveFinite(s)) return s;
		for(int i=0; i<array.length; i++) array[i]/=s;
		return s;
	}

	public static boolean isPositiveFinite(double d) {
		return d>0 && !Double.isInfinite(d);
	}

	public static boolean sumsToOne(double[] array, double tolerance) {
		return Math.abs(StatUtils.sum(array)-1.0)<=tolerance;
	}

	public static double[] column(double[][] matrix, int j) {
		double[] col = new double[matrix.length];
		for(int i=0; i<matrix.length; i++) col[i] = matrix[i][j];
		return col;
	}

	public static double[][] copyOf(double[][] matrix) {
		double[][] copy = new double[matrix.length][];
		for(int i=0; i<matrix.length; i++)
			copy[i] = matrix[i].clone();
		return copy;
	}

	public static int[][] copyOf(int[][] matrix) {
		int[][] copy = new int[matrix.length][];
		for(int i=0; i<matrix.length; i++)
			copy[i] = matrix[i].clone();
		return copy;
	}
}
