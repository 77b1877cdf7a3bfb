package morriscore.random;

/**
 * Единственный источник случайности генератора траекторий.
 *
 * Порядок вызовов определяет воспроизводимость: при одинаковом зерне
 * и одинаковой последовательности вызовов результат должен совпадать.
 */
public interface RandomSource {

    /**
     * @param bound верхняя граница (не включая), > 0
     * @return равномерное целое в [0; bound)
     */
    int nextInt(int bound);

    /**
     * @param n размер перестановки (n >= 0)
     * @return равновероятная перестановка чисел 0..n-1
     */
    int[] nextPermutation(int n);

    /**
     * @param n число направлений (n >= 0)
     * @return массив из n независимых значений +1 / -1 с вероятностью 1/2
     */
    int[] nextDirections(int n);
}
