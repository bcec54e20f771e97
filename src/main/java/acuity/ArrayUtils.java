package acuity;

/*----------------------------------------------------------------------------------------------------------- */
/*----------------------------------------------------------------------------------------------------------- */
/*                                                                                                            */
/*                                     ArrayUtils class                                                       */
/*                                                                                                            */
/*----------------------------------------------------------------------------------------------------------- */
/*----------------------------------------------------------------------------------------------------------- */
public class ArrayUtils
{
	private ArrayUtils() {}

	/**
	 * Find index of the maximum value in an array
	 * @param array an array, not empty
	 * @return the argmax (lowest index in case of duplicate values)
	 */
	static int argmax(double[] array)
	{
		int locationOfExtreme = 0;
		double extreme = array[locationOfExtreme];

		for (int i = 1; i < array.length; i++)
		{
			if (array[i] > extreme)
			{
				extreme = array[i];
				locationOfExtreme = i;
			}
		}
		return locationOfExtreme;
	}

	/**
	 * Pick one column out of a table of rows
	 * @param rows
	 * @param column index into each row
	 * @return the column values in row order
	 */
	static double[] column(float[][] rows, int column)
	{
		double[] values = new double[rows.length];
		for (int row = 0; row < rows.length; row++)
		{
			values[row] = rows[row][column];
		}
		return values;
	}
}
/*----------------------------------------------------------------------------------------------------------- */
/*----------------------------------------------------------------------------------------------------------- */
/*                                                                                                            */
/*                                   End ArrayUtils Class                                                     */
/*                                                                                                            */
/*----------------------------------------------------------------------------------------------------------- */
/*----------------------------------------------------------------------------------------------------------- */
